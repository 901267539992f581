package com.slb.fleet_backend.modules.command.service;

import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.modules.command.domain.CommandSpec;
import com.slb.fleet_backend.modules.command.domain.ValidatedCommand;
import com.slb.fleet_backend.modules.command.enums.CommandType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CommandPayloadValidatorTest {

    private final CommandPayloadValidator validator = new CommandPayloadValidator();

    @Test
    void miner_actionNormalized() {
        ValidatedCommand command = validator.validate(new CommandSpec("Miner", Map.of("action", " Restart ")));

        assertThat(command.type()).isEqualTo(CommandType.MINER);
        assertThat(command.payload()).containsEntry("action", "restart");
    }

    @Test
    void miner_unknownAction_rejectedWithFieldPath() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(List.of(
                        new CommandSpec("reboot", null),
                        new CommandSpec("miner", Map.of("action", "pause")))));

        assertThat(ex.getFieldErrors()).containsKey("commands[1].payload.action");
    }

    @Test
    void romFlash_requiresGpusAndHttpUrl() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(new CommandSpec("rom-flash", Map.of("gpus", List.of(0, -1), "url", "ftp://x/bios.rom"))));

        assertThat(ex.getFieldErrors()).containsKeys("commands[0].payload.gpus", "commands[0].payload.url");
    }

    @Test
    void romFlash_valid_keepsForceAndDedupesGpus() {
        ValidatedCommand command = validator.validate(new CommandSpec("rom_flash",
                Map.of("gpus", List.of(0, 2, 2), "url", "https://cdn.example.com/bios.rom", "force", true, "extra", "x")));

        assertThat(command.payload()).containsEntry("gpus", List.of(0, 2))
                .containsEntry("force", true)
                .doesNotContainKey("extra");
    }

    @Test
    void exec_tooLong_rejected() {
        String longCommand = "x".repeat(4097);

        assertThrows(ValidationException.class,
                () -> validator.validate(new CommandSpec("exec", Map.of("command", longCommand))));
    }

    @Test
    void overclockApply_cannotBeSentAsRawCommand() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(new CommandSpec("overclock_apply", Map.of())));

        assertThat(ex.getFieldErrors()).containsKey("commands[0].type");
    }

    @Test
    void unknownType_rejected() {
        assertThrows(ValidationException.class, () -> validator.validate(new CommandSpec("selfdestruct", null)));
    }

    @Test
    void upgrade_versionOptional() {
        assertThat(validator.validate(new CommandSpec("upgrade", null)).payload()).isEmpty();
        assertThat(validator.validate(new CommandSpec("upgrade", Map.of("version", "0.6-227"))).payload())
                .containsEntry("version", "0.6-227");
    }
}
