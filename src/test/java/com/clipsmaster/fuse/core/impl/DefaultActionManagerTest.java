package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.model.FuseLevel;
import com.clipsmaster.fuse.model.MitigationAction;
import com.clipsmaster.fuse.model.ParameterCheckResult;
import com.clipsmaster.fuse.model.ParameterDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultActionManagerTest {

    private static MitigationAction trim() {
        return MitigationAction.builder("trim")
                .parameter(new ParameterDefinition("ratio", "NUMBER", 0.5, "fraction to drop").range(0.0, 1.0))
                .parameter(new ParameterDefinition("aggressive", "BOOLEAN", false, "extra passes"))
                .parameter(new ParameterDefinition("target_level", "STRING", "WARN", "log level")
                        .allowed(List.of("WARN", "ERROR")))
                .parameter(new ParameterDefinition("dir", "STRING", true, null, "work dir"))
                .build();
    }

    private static DefaultActionManager managerWith(Map<String, Object> params) {
        return new DefaultActionManager(null, new OriginalSettings(), Map.of("trim", params));
    }

    @Test
    void executePassesConfiguredParametersAndLevel() {
        DefaultActionManager manager = managerWith(Map.of("ratio", "0.25", "dir", "/tmp/x"));
        AtomicReference<Double> ratio = new AtomicReference<>();
        AtomicReference<FuseLevel> level = new AtomicReference<>();
        manager.registerAction(trim(), ctx -> {
            ratio.set(ctx.getParameter("ratio", 0.5));
            level.set(ctx.getLevel());
            return true;
        });

        assertThat(manager.executeAction("trim", FuseLevel.CRITICAL)).isTrue();
        assertThat(ratio.get()).isEqualTo(0.25);
        assertThat(level.get()).isEqualTo(FuseLevel.CRITICAL);
    }

    @Test
    void unknownActionIsNotExecuted() {
        DefaultActionManager manager = managerWith(Map.of());
        assertThat(manager.executeAction("ghost", FuseLevel.EMERGENCY)).isFalse();
    }

    @Test
    void emergencyOnlyActionIsGuarded() {
        DefaultActionManager manager = managerWith(Map.of());
        manager.registerAction(MitigationAction.builder("kill").emergencyOnly().build(), ctx -> true);

        assertThat(manager.executeAction("kill", FuseLevel.CRITICAL)).isFalse();
        assertThat(manager.executeAction("kill", FuseLevel.EMERGENCY)).isTrue();
    }

    @Test
    void handlerExceptionBecomesFailure() {
        DefaultActionManager manager = managerWith(Map.of());
        manager.registerAction(MitigationAction.builder("boom").build(), ctx -> {
            throw new java.io.IOException("disk");
        });

        assertThat(manager.executeAction("boom", FuseLevel.WARNING)).isFalse();
    }

    @Test
    void catalogKeepsRegistrationOrderAndSupportsReplacement() {
        DefaultActionManager manager = managerWith(Map.of());
        manager.registerAction(MitigationAction.builder("b").build(), ctx -> true);
        manager.registerAction(MitigationAction.builder("a").build(), ctx -> true);
        manager.registerAction(MitigationAction.builder("b").expectedReductionMb(42).build(), ctx -> false);

        assertThat(manager.getCatalog()).extracting(MitigationAction::getName).containsExactly("b", "a");
        assertThat(manager.getAction("b").getExpectedReductionMb()).isEqualTo(42.0);
        assertThat(manager.executeAction("b", FuseLevel.WARNING)).isFalse();

        assertThat(manager.unregisterAction("a")).isTrue();
        assertThat(manager.unregisterAction("a")).isFalse();
        assertThat(manager.getAction("a")).isNull();
    }

    @Test
    void rejectsNullRegistration() {
        DefaultActionManager manager = managerWith(Map.of());
        assertThatThrownBy(() -> manager.registerAction(null, ctx -> true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void validParametersPass() {
        DefaultActionManager manager = managerWith(Map.of("ratio", "0.3", "aggressive", "TRUE",
                "target_level", "error", "dir", "/tmp"));
        manager.registerAction(trim(), ctx -> true);

        ParameterCheckResult result = manager.validateParameters("trim");

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    void invalidParametersAreReported() {
        DefaultActionManager manager = managerWith(Map.of("ratio", "1.5", "aggressive", "maybe",
                "target_level", "TRACE", "colour", "blue"));
        manager.registerAction(trim(), ctx -> true);

        ParameterCheckResult result = manager.validateParameters("trim");

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).hasSize(4)
                .anyMatch(e -> e.contains("exceeds maximum"))
                .anyMatch(e -> e.contains("expects BOOLEAN"))
                .anyMatch(e -> e.contains("not in allowed values"))
                .anyMatch(e -> e.contains("'dir' is missing"));
        assertThat(result.getWarnings()).singleElement().asString().contains("colour");
    }

    @Test
    void nonNumericValueIsReported() {
        DefaultActionManager manager = managerWith(Map.of("ratio", "lots", "dir", "/tmp"));
        manager.registerAction(trim(), ctx -> true);

        assertThat(manager.validateParameters("trim").getErrors())
                .singleElement().asString().contains("expects NUMBER");
    }

    @Test
    void validatingUnknownActionFails() {
        assertThat(managerWith(Map.of()).validateParameters("ghost").isValid()).isFalse();
    }
}
