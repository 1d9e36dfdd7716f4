package com.mythos.api.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MythosConfigValidator")
class MythosConfigValidatorTest {

    private static MythosConfigValidator validator(long windowMs, int scriptCeiling, int minWords, int maxWords, int maxPanels) {
        return new MythosConfigValidator("development", windowMs, scriptCeiling, 0,
                minWords, maxWords, maxPanels, "synthetic", "");
    }

    @Test
    @DisplayName("기본 설정은 통과")
    void defaultsAreValid() {
        MythosConfigValidator validator = validator(60_000, 0, 3, 20, 50);

        assertThat(validator.validate()).isEmpty();
        validator.run(null);
    }

    @Test
    @DisplayName("잘못된 값은 모두 보고")
    void reportsEveryProblem() {
        MythosConfigValidator validator = validator(0, -1, 5, 4, 0);

        assertThat(validator.validate()).hasSize(4);
        assertThatThrownBy(() -> validator.run(null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("window-ms");
    }
}
