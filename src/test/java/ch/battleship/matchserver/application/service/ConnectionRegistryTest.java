package ch.battleship.matchserver.application.service;

import ch.battleship.matchserver.domain.Player;
import ch.battleship.matchserver.service.ConnectionRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionRegistryTest {

    private final ConnectionRegistry registry = new ConnectionRegistry();

    @Test
    void register_shouldMakePlayerFindableByConnection() {
        Player alice = new Player("Alice", "conn-a");

        registry.register(alice);

        assertThat(registry.isRegistered("conn-a")).isTrue();
        assertThat(registry.find("conn-a")).containsSame(alice);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void register_shouldReject_secondPlayerOnSameConnection() {
        registry.register(new Player("Alice", "conn-a"));

        assertThatThrownBy(() -> registry.register(new Player("Alice2", "conn-a")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Already joined");
        assertThat(registry.find("conn-a").orElseThrow().getUsername()).isEqualTo("Alice");
    }

    @Test
    void remove_shouldReturnPlayerOnce() {
        Player alice = new Player("Alice", "conn-a");
        registry.register(alice);

        assertThat(registry.remove("conn-a")).containsSame(alice);
        assertThat(registry.remove("conn-a")).isEmpty();
        assertThat(registry.size()).isZero();
    }

    @Test
    void find_shouldReturnEmpty_forUnknownConnection() {
        assertThat(registry.find("unknown")).isEmpty();
        assertThat(registry.isRegistered("unknown")).isFalse();
    }
}
