package com.clipsmaster.fuse.actions;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.clipsmaster.fuse.core.impl.DefaultActionContext;
import com.clipsmaster.fuse.core.impl.OriginalSettings;
import com.clipsmaster.fuse.model.FuseLevel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReduceLogVerbosityActionTest {

    private final Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    private Level before;

    @BeforeEach
    void rememberLevel() {
        before = root.getLevel();
        root.setLevel(Level.DEBUG);
    }

    @AfterEach
    void restoreLevel() {
        root.setLevel(before);
    }

    @Test
    void raisesRootLevelAndRestoresOriginal() throws Exception {
        OriginalSettings settings = new OriginalSettings();

        boolean result = new ReduceLogVerbosityAction().execute(new DefaultActionContext(
                "reduce_log_verbosity", FuseLevel.WARNING, Map.of("target_level", "ERROR"), null, settings));

        assertThat(result).isTrue();
        assertThat(root.getLevel()).isEqualTo(Level.ERROR);
        assertThat(settings.contains("log_level")).isTrue();

        settings.restoreAll();
        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void warningIsAnAliasOfWarn() throws Exception {
        new ReduceLogVerbosityAction().execute(new DefaultActionContext(
                "reduce_log_verbosity", FuseLevel.WARNING, Map.of("target_level", "WARNING"), null,
                new OriginalSettings()));

        assertThat(root.getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void repeatedReductionKeepsTheFirstOriginal() throws Exception {
        OriginalSettings settings = new OriginalSettings();
        ReduceLogVerbosityAction action = new ReduceLogVerbosityAction();

        action.execute(new DefaultActionContext("reduce_log_verbosity", FuseLevel.WARNING,
                Map.of("target_level", "WARN"), null, settings));
        action.execute(new DefaultActionContext("reduce_log_verbosity", FuseLevel.CRITICAL,
                Map.of("target_level", "ERROR"), null, settings));
        settings.restoreAll();

        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
    }
}
