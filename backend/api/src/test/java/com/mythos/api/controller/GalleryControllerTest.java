package com.mythos.api.controller;

import com.mythos.api.dto.GalleryDto;
import com.mythos.api.service.gallery.GalleryService;
import com.mythos.common.enums.SceneCategory;
import com.mythos.common.enums.StyleCategory;
import com.mythos.common.exception.ApiException;
import com.mythos.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GalleryController.class)
@DisplayName("GalleryController")
class GalleryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GalleryService galleryService;

    private static GalleryDto.PanelInfo panel(long id) {
        return GalleryDto.PanelInfo.builder()
                .id(id)
                .scene("Krishna lifts the mountain")
                .narratorCaption("Krishna lifts Govardhan.")
                .dialogue("")
                .imageRef("https://img.example/" + id)
                .styleCategory(StyleCategory.VIBRANT)
                .sceneCategory(SceneCategory.GENERAL)
                .build();
    }

    @Test
    @DisplayName("목록 조회")
    void listsPanels() throws Exception {
        when(galleryService.list()).thenReturn(List.of(panel(2), panel(1)));

        mockMvc.perform(get("/api/panels"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].id").value(2))
                .andExpect(jsonPath("$.data[0].styleCategory").value("vibrant"));
    }

    @Test
    @DisplayName("저장")
    void savesPanel() throws Exception {
        when(galleryService.save(any())).thenReturn(panel(7));

        mockMvc.perform(post("/api/panels")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"scene": "Krishna lifts the mountain", "narrator_caption": "Krishna lifts Govardhan.",
                                 "imageUrl": "https://img.example/7", "styleCategory": "vibrant"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(7));
    }

    @Test
    @DisplayName("없는 패널 삭제는 404")
    void deleteMissingPanel() throws Exception {
        doThrow(new ApiException(ErrorCode.PANEL_NOT_FOUND)).when(galleryService).delete(99L);

        mockMvc.perform(delete("/api/panels/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("P001"));
    }

    @Test
    @DisplayName("숫자가 아닌 ID는 400")
    void nonNumericIdIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/panels/abc/favorite"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(galleryService);
    }

    @Test
    @DisplayName("통계")
    void stats() throws Exception {
        when(galleryService.stats()).thenReturn(GalleryDto.Stats.builder()
                .totalPanels(3).favoritePanels(1).maxPanels(50).build());

        mockMvc.perform(get("/api/panels/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalPanels").value(3))
                .andExpect(jsonPath("$.data.maxPanels").value(50));
    }
}
