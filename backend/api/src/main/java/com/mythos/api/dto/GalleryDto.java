package com.mythos.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.mythos.api.entity.SavedPanel;
import com.mythos.common.enums.SceneCategory;
import com.mythos.common.enums.StyleCategory;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 갤러리 API DTO
 */
public class GalleryDto {

    /**
     * 패널 저장 요청
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SaveRequest {
        private String scene;
        @JsonAlias("narrator_caption")
        private String narratorCaption;
        private String dialogue;
        @JsonAlias("image_description")
        private String visualDescription;
        @JsonAlias("imageUrl")
        private String imageRef;
        private StyleCategory styleCategory;
        private SceneCategory sceneCategory;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PanelInfo {
        private Long id;
        private String scene;
        private String narratorCaption;
        private String dialogue;
        private String visualDescription;
        private String imageRef;
        private StyleCategory styleCategory;
        private SceneCategory sceneCategory;
        private boolean favorite;
        private LocalDateTime createdAt;

        public static PanelInfo from(SavedPanel panel) {
            return PanelInfo.builder()
                    .id(panel.getPanelId())
                    .scene(panel.getScene())
                    .narratorCaption(panel.getNarratorCaption())
                    .dialogue(panel.getDialogue())
                    .visualDescription(panel.getVisualDescription())
                    .imageRef(panel.getImageRef())
                    .styleCategory(StyleCategory.fromCode(panel.getStyleCategory()))
                    .sceneCategory(SceneCategory.fromCode(panel.getSceneCategory()))
                    .favorite(Boolean.TRUE.equals(panel.getIsFavorite()))
                    .createdAt(panel.getCreatedAt())
                    .build();
        }
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Stats {
        private long totalPanels;
        private long favoritePanels;
        private int maxPanels;
    }
}
