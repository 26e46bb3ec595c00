package com.wordhub.gameservice.platform.ws;

import com.wordhub.gameservice.games.words.domain.port.GameEvents;
import com.wordhub.gameservice.games.words.domain.port.GameNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class GameConnectionRegistryTest {

    @Mock
    private GameNotifier notifier;

    private GameConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new GameConnectionRegistry(notifier);
    }

    @Test
    @DisplayName("connections are tracked per game and broadcast on change")
    void connectAndDisconnect() {
        registry.connected("s1", "g1", "ann");
        registry.connected("s2", "g1", "bob");
        registry.connected("s3", "g2", "cat");

        assertThat(registry.connectedPlayers("g1")).containsExactlyInAnyOrder("ann", "bob");
        verify(notifier).notifyAll("g1", GameEvents.CONNECTIONS, Set.of("ann", "bob"));

        registry.disconnected("s1");

        assertThat(registry.connectedPlayers("g1")).containsExactly("bob");
        assertThat(registry.connectedPlayers("g2")).containsExactly("cat");
        verify(notifier).notifyAll("g1", GameEvents.CONNECTIONS, Set.of("bob"));
    }

    @Test
    @DisplayName("unknown sessions disconnect silently")
    void unknownSession() {
        registry.disconnected("nope");
        registry.disconnected(null);

        assertThat(registry.connectedPlayers("g1")).isEmpty();
        verifyNoInteractions(notifier);
    }
}
