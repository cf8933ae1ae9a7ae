package com.questrail.harness.config;

import com.questrail.harness.api.AppSource;
import com.questrail.harness.api.DnaDeclaration;
import com.questrail.harness.api.DnaSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PlayerConfigsTest {

    private static final PlayerConfig CONFIG = PlayerConfig.of(DnaDeclaration.of("x", DnaSource.path("x.dna")));

    @Test
    void instanceIdsMustBeUnique() {
        assertThrows(IllegalArgumentException.class, () -> PlayerConfig.of(
                DnaDeclaration.of("x", DnaSource.path("a.dna")),
                DnaDeclaration.of("x", DnaSource.path("b.dna"))));
        assertThrows(IllegalArgumentException.class, () -> new PlayerConfig(List.of(), Optional.empty()));
    }

    @Test
    void playerConfigBecomesDnaSource() {
        AppSource.Dnas source = assertInstanceOf(AppSource.Dnas.class, CONFIG.withAppId("app").toAppSource());

        assertEquals(CONFIG.instances(), source.dnas());
    }

    @Test
    void playersKeepDeclarationOrderAndRejectDuplicates() {
        PlayerConfigs players = PlayerConfigs.of("carol", CONFIG).with("alice", CONFIG).with("bob", CONFIG);

        assertEquals(List.of("carol", "alice", "bob"), List.copyOf(players.players().keySet()));
        assertThrows(IllegalArgumentException.class, () -> players.with("alice", CONFIG));
    }

    @Test
    void allPlayersFlattensMachines() {
        MachineConfigs machines = new MachineConfigs(Map.of(
                "ws://m1:9000", PlayerConfigs.of("alice", CONFIG),
                "ws://m2:9000", PlayerConfigs.of("bob", CONFIG)));

        assertEquals(2, machines.allPlayers().size());
        assertEquals(MachineConfigs.LOCAL, MachineConfigs.local(PlayerConfigs.of("a", CONFIG))
                .machines().keySet().iterator().next());
    }

    @Test
    void allPlayersRejectsPlayerOnTwoMachines() {
        MachineConfigs machines = new MachineConfigs(Map.of(
                "ws://m1:9000", PlayerConfigs.of("alice", CONFIG),
                "ws://m2:9000", PlayerConfigs.of("alice", CONFIG)));

        assertThrows(IllegalArgumentException.class, machines::allPlayers);
    }
}
