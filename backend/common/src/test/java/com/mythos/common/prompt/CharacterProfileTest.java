package com.mythos.common.prompt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CharacterProfile")
class CharacterProfileTest {

    @Test
    @DisplayName("별칭으로 캐릭터 인식")
    void recognizesByAlias() {
        assertThat(CharacterProfile.recognize("Govinda plays the flute")).contains(CharacterProfile.KRISHNA);
        assertThat(CharacterProfile.recognize("Maruti leaps across the ocean")).contains(CharacterProfile.HANUMAN);
        assertThat(CharacterProfile.recognize("Lord Ganesh writes the epic")).contains(CharacterProfile.GANESHA);
    }

    @Test
    @DisplayName("단어 일부는 별칭으로 보지 않음")
    void ignoresAliasInsideLongerWord() {
        assertThat(CharacterProfile.RAMA.mentionedIn("a dramatic sunset over the river")).isFalse();
        assertThat(CharacterProfile.recognize("a dramatic sunset over the river")).isEmpty();
    }

    @Test
    @DisplayName("여러 캐릭터가 있으면 먼저 선언된 캐릭터")
    void prefersDeclarationOrder() {
        assertThat(CharacterProfile.recognize("Rama and Hanuman cross the bridge")).contains(CharacterProfile.HANUMAN);
        assertThat(CharacterProfile.recognize("Arjuna listens to Krishna")).contains(CharacterProfile.KRISHNA);
    }

    @Test
    @DisplayName("빈 텍스트는 인식 없음")
    void emptyTextRecognizesNothing() {
        assertThat(CharacterProfile.recognize(null)).isEmpty();
        assertThat(CharacterProfile.recognize("   ")).isEmpty();
    }
}
