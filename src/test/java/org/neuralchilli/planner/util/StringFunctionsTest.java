package org.neuralchilli.planner.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StringFunctionsTest {

    @Test
    void shouldStripInlineTags() {
        assertThat(StringFunctions.displayText("Write report #Task #work")).isEqualTo("Write report");
        assertThat(StringFunctions.displayText("#Task Call #[[Big Client]] back")).isEqualTo("Call back");
    }

    @Test
    void shouldCollapseWhitespace() {
        assertThat(StringFunctions.displayText("  Fix\tthe\n\nbuild  ")).isEqualTo("Fix the build");
        assertThat(StringFunctions.collapseWhitespace(null)).isEmpty();
    }

    @Test
    void shouldFallBackToUntitled() {
        assertThat(StringFunctions.displayText(null)).isEqualTo(StringFunctions.UNTITLED);
        assertThat(StringFunctions.displayText("   ")).isEqualTo(StringFunctions.UNTITLED);
        assertThat(StringFunctions.displayText("#Task")).isEqualTo(StringFunctions.UNTITLED);
    }

    @Test
    void shouldKeepHashInsideWords() {
        assertThat(StringFunctions.displayText("Issue C# migration #Task")).isEqualTo("Issue C# migration");
    }
}
