package com.mythos.api.controller;

import com.mythos.api.config.DeploymentProfile;
import com.mythos.api.dto.PanelDto;
import com.mythos.api.service.pipeline.ComicPanelOrchestrator;
import com.mythos.api.service.pipeline.GenerationRejectedException;
import com.mythos.api.service.pipeline.PipelineState;
import com.mythos.api.service.pipeline.RejectReason;
import com.mythos.api.service.provider.GenerationProvider;
import com.mythos.api.service.provider.ProviderMode;
import com.mythos.api.service.ratelimit.RateLimitService;
import com.mythos.api.service.script.GeneratedScript;
import com.mythos.common.enums.ErrorType;
import com.mythos.common.exception.ApiException;
import com.mythos.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PanelController.class)
@DisplayName("PanelController")
class PanelControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ComicPanelOrchestrator orchestrator;

    @MockBean
    private RateLimitService rateLimitService;

    @MockBean
    private GenerationProvider generationProvider;

    @MockBean
    private Clock clock;

    @Test
    @DisplayName("스크립트 생성 성공 응답은 snake_case 스크립트 키")
    void generateScriptReturnsScript() throws Exception {
        PanelDto.ScriptResponse response = PanelDto.ScriptResponse.builder()
                .script(new GeneratedScript("Hanuman leaps.", "For Rama!", "Hanuman over the sea"))
                .metadata(PanelDto.Metadata.builder().finalState("STRUCTURALLY_VALID").build())
                .build();
        when(orchestrator.generateScript(any(), anyString())).thenReturn(response);

        mockMvc.perform(post("/api/generate-script")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scene\": \"Hanuman leaps across the ocean\", \"sceneType\": \"action\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.script.narrator_caption").value("Hanuman leaps."))
                .andExpect(jsonPath("$.data.script.image_description").value("Hanuman over the sea"))
                .andExpect(jsonPath("$.data.metadata.finalState").value("STRUCTURALLY_VALID"));

        ArgumentCaptor<PanelDto.ScriptRequest> captor = ArgumentCaptor.forClass(PanelDto.ScriptRequest.class);
        verify(orchestrator).generateScript(captor.capture(), eq("127.0.0.1"));
        assertThat(captor.getValue().getSceneCategory().getCode()).isEqualTo("action");
    }

    @Test
    @DisplayName("X-Forwarded-For 첫 항목을 클라이언트 식별자로 사용")
    void usesForwardedForIdentity() throws Exception {
        when(orchestrator.completePanel(any(), anyString())).thenReturn(PanelDto.CompletePanelResponse.builder().build());

        mockMvc.perform(post("/api/complete-comic-panel")
                        .header("X-Forwarded-For", "10.0.0.1, 172.16.0.1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scene\": \"Krishna lifts the mountain\"}"))
                .andExpect(status().isOk());

        verify(orchestrator).completePanel(any(), eq("10.0.0.1"));
    }

    @Test
    @DisplayName("rate limit 거부는 429 + errorType + resetAt")
    void rateLimitRejectionMapsTo429() throws Exception {
        when(orchestrator.generateImage(any(), anyString())).thenThrow(new GenerationRejectedException(
                RejectReason.RATE_LIMITED, PipelineState.IDLE, ErrorType.IMAGE_GENERATION_ERROR,
                "Image generation rate limit exceeded. Please try again later.", 1_767_225_660_000L));

        mockMvc.perform(post("/api/generate-image")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"imageDescription\": \"Hanuman over the sea\", \"styleType\": \"earth\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("R001"))
                .andExpect(jsonPath("$.errorType").value("image_generation_error"))
                .andExpect(jsonPath("$.resetAt").value(1_767_225_660_000L));
    }

    @Test
    @DisplayName("부적절한 입력 거부는 400")
    void unsafeInputMapsTo400() throws Exception {
        when(orchestrator.generateScript(any(), anyString())).thenThrow(new GenerationRejectedException(
                RejectReason.UNSAFE_INPUT, PipelineState.ADMITTED_SCRIPT, ErrorType.GENERAL_ERROR,
                "Scene description contains inappropriate content. Please modify your request.", null));

        mockMvc.perform(post("/api/generate-script")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scene\": \"kill the enemy now\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("G002"))
                .andExpect(jsonPath("$.errorType").value("general_error"))
                .andExpect(jsonPath("$.resetAt").doesNotExist());
    }

    @Test
    @DisplayName("잘못된 JSON 본문은 400")
    void malformedBodyMapsTo400() throws Exception {
        mockMvc.perform(post("/api/generate-script")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C002"));

        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("예상치 못한 오류는 500과 요청 ID")
    void unexpectedErrorMapsTo500() throws Exception {
        when(orchestrator.generateScript(any(), anyString())).thenThrow(new IllegalStateException("db down"));

        mockMvc.perform(post("/api/generate-script")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scene\": \"Krishna plays the flute\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("C001"))
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("Request ID")));
    }

    @Test
    @DisplayName("개발 환경 리셋")
    void resetRateLimits() throws Exception {
        when(rateLimitService.resetAll()).thenReturn(1_767_225_600_000L);

        mockMvc.perform(post("/api/reset-rate-limits"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.message").value("Rate limits reset successfully"))
                .andExpect(jsonPath("$.data.timestamp").exists());
    }

    @Test
    @DisplayName("production 리셋은 403")
    void resetForbiddenInProduction() throws Exception {
        when(rateLimitService.resetAll()).thenThrow(new ApiException(ErrorCode.FORBIDDEN, "Rate limit reset is not available in production"));

        mockMvc.perform(post("/api/reset-rate-limits"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("C004"));
    }

    @Test
    @DisplayName("헬스 체크")
    void health() throws Exception {
        when(generationProvider.getMode()).thenReturn(ProviderMode.SYNTHETIC);
        when(rateLimitService.getProfile()).thenReturn(DeploymentProfile.DEVELOPMENT);
        when(clock.instant()).thenReturn(Instant.parse("2026-01-01T00:00:00Z"));

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("OK"))
                .andExpect(jsonPath("$.data.providerMode").value("synthetic"))
                .andExpect(jsonPath("$.data.profile").value("development"));
    }
}
