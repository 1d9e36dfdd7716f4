package com.mythos.api.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 갤러리에 저장된 완성 패널
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavedPanel {
    private Long panelId;
    private String scene;
    private String narratorCaption;
    private String dialogue;
    private String visualDescription;
    private String imageRef;
    private String styleCategory;       // vibrant, earth, divine
    private String sceneCategory;       // general, action, spiritual
    private Boolean isFavorite;
    private LocalDateTime createdAt;
}
