package com.mythos.api.service.script;

import com.mythos.api.service.provider.GenerationProvider;
import com.mythos.api.service.provider.ProviderErrorType;
import com.mythos.api.service.provider.ProviderException;
import com.mythos.api.service.provider.ScriptPrompt;
import com.mythos.common.enums.SceneCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScriptGeneratorServiceImpl")
class ScriptGeneratorServiceImplTest {

    private static final String PRIMARY = "gpt-4o-mini";
    private static final String FALLBACK = "gpt-3.5-turbo";

    @Mock
    private GenerationProvider generationProvider;

    private ScriptGeneratorServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new ScriptGeneratorServiceImpl(generationProvider, new ScriptPromptBuilder(), PRIMARY, FALLBACK);
    }

    @Test
    @DisplayName("주 모델 성공")
    void usesPrimaryModel() {
        when(generationProvider.completeText(any(ScriptPrompt.class), eq(PRIMARY))).thenReturn("{}");

        ScriptGeneratorService.ScriptCompletion completion = service.generate("Rama breaks the bow", SceneCategory.ACTION);

        assertThat(completion.getModel()).isEqualTo(PRIMARY);
        assertThat(completion.isFallbackModelUsed()).isFalse();
        verify(generationProvider, never()).completeText(any(), eq(FALLBACK));
    }

    @Test
    @DisplayName("주 모델이 없으면 fallback 모델로 한 번 재시도")
    void fallsBackOnceWhenModelNotFound() {
        when(generationProvider.completeText(any(ScriptPrompt.class), eq(PRIMARY)))
                .thenThrow(new ProviderException(ProviderErrorType.MODEL_NOT_FOUND, "model missing", 404, null));
        when(generationProvider.completeText(any(ScriptPrompt.class), eq(FALLBACK))).thenReturn("{\"ok\":true}");

        ScriptGeneratorService.ScriptCompletion completion = service.generate("Rama breaks the bow", SceneCategory.GENERAL);

        assertThat(completion.getModel()).isEqualTo(FALLBACK);
        assertThat(completion.isFallbackModelUsed()).isTrue();
        assertThat(completion.getRawText()).isEqualTo("{\"ok\":true}");
        verify(generationProvider, times(1)).completeText(any(), eq(FALLBACK));
    }

    @Test
    @DisplayName("fallback 실패는 그대로 전파")
    void propagatesFallbackFailure() {
        when(generationProvider.completeText(any(ScriptPrompt.class), eq(PRIMARY)))
                .thenThrow(new ProviderException(ProviderErrorType.MODEL_NOT_FOUND, "model missing", 404, null));
        when(generationProvider.completeText(any(ScriptPrompt.class), eq(FALLBACK)))
                .thenThrow(new ProviderException(ProviderErrorType.TRANSPORT, "bad gateway", 502, null));

        assertThatThrownBy(() -> service.generate("Rama breaks the bow", SceneCategory.GENERAL))
                .isInstanceOf(ProviderException.class)
                .extracting(e -> ((ProviderException) e).getType())
                .isEqualTo(ProviderErrorType.TRANSPORT);
    }

    @Test
    @DisplayName("모델 없음 이외의 오류는 fallback 없이 전파")
    void doesNotFallBackOnOtherErrors() {
        when(generationProvider.completeText(any(ScriptPrompt.class), eq(PRIMARY)))
                .thenThrow(new ProviderException(ProviderErrorType.TIMEOUT, "timed out"));

        assertThatThrownBy(() -> service.generate("Rama breaks the bow", SceneCategory.GENERAL))
                .isInstanceOf(ProviderException.class);
        verify(generationProvider, never()).completeText(any(), eq(FALLBACK));
    }

    @Test
    @DisplayName("장면 분류에 따라 프레이밍 추가")
    void appendsCategoryFraming() {
        when(generationProvider.completeText(any(ScriptPrompt.class), eq(PRIMARY))).thenReturn("{}");
        ArgumentCaptor<ScriptPrompt> captor = ArgumentCaptor.forClass(ScriptPrompt.class);

        service.generate("Shiva \"meditates\" on Kailash", SceneCategory.SPIRITUAL);

        verify(generationProvider).completeText(captor.capture(), eq(PRIMARY));
        ScriptPrompt prompt = captor.getValue();
        assertThat(prompt.getUserPrompt()).contains("Spiritual transformation");
        assertThat(prompt.getUserPrompt()).contains("USER SCENE: \"Shiva 'meditates' on Kailash\"");
        assertThat(prompt.getScene()).isEqualTo("Shiva \"meditates\" on Kailash");
    }
}
