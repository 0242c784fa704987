package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.model.FuseLevel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultActionContextTest {

    private static DefaultActionContext context(Map<String, Object> params) {
        return new DefaultActionContext("test", FuseLevel.WARNING, params, null, new OriginalSettings());
    }

    @Test
    void convertsStringValuesToDefaultType() {
        DefaultActionContext ctx = context(Map.of("times", "5", "hours", "1.5", "on", "true"));

        assertThat(ctx.getParameter("times", 3)).isEqualTo(5);
        assertThat(ctx.getParameter("hours", 2.0)).isEqualTo(1.5);
        assertThat(ctx.getParameter("on", false)).isTrue();
    }

    @Test
    void fallsBackToDefaultOnMissingOrInvalidValue() {
        DefaultActionContext ctx = context(Map.of("times", "many", "on", "perhaps"));

        assertThat(ctx.getParameter("times", 3)).isEqualTo(3);
        assertThat(ctx.getParameter("on", false)).isFalse();
        assertThat(ctx.getParameter("absent", "x")).isEqualTo("x");
    }

    @Test
    void numbersAreNarrowedToDefaultType() {
        DefaultActionContext ctx = context(Map.of("times", 4.0));
        assertThat(ctx.getParameter("times", 3)).isEqualTo(4);
    }

    @Test
    void listParametersSplitOnCommas() {
        DefaultActionContext ctx = context(Map.of("dirs", " /a, /b ,,/c", "names", List.of("x", " y")));

        assertThat(ctx.getListParameter("dirs", List.of())).containsExactly("/a", "/b", "/c");
        assertThat(ctx.getListParameter("names", List.of())).containsExactly("x", "y");
        assertThat(ctx.getListParameter("missing", List.of("d"))).containsExactly("d");
    }

    @Test
    void savedSettingsAreRestoredInReverseOrderOnce() {
        OriginalSettings settings = new OriginalSettings();
        StringBuilder order = new StringBuilder();
        settings.save("a", () -> order.append('a'));
        settings.save("b", () -> order.append('b'));
        settings.save("a", () -> order.append('X'));
        settings.save("c", () -> {
            throw new IllegalStateException("cannot");
        });

        assertThat(settings.restoreAll()).isEqualTo(2);
        assertThat(order.toString()).isEqualTo("ba");
        assertThat(settings.size()).isZero();
        assertThat(settings.restoreAll()).isZero();
    }
}
