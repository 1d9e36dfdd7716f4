package com.mythos.api.service.gallery;

import com.mythos.api.dto.GalleryDto;
import com.mythos.api.entity.SavedPanel;
import com.mythos.api.mapper.SavedPanelMapper;
import com.mythos.common.enums.SceneCategory;
import com.mythos.common.enums.StyleCategory;
import com.mythos.common.exception.ApiException;
import com.mythos.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 완성 패널 갤러리 (최신 N개만 보관)
 */
@Slf4j
@Service
public class GalleryService {

    private final SavedPanelMapper savedPanelMapper;
    private final Clock clock;
    private final int maxPanels;

    public GalleryService(SavedPanelMapper savedPanelMapper, Clock clock,
                          @Value("${mythos.gallery.max-panels:50}") int maxPanels) {
        this.savedPanelMapper = savedPanelMapper;
        this.clock = clock;
        this.maxPanels = maxPanels;
    }

    /**
     * 패널 저장 후 보관 한도를 넘는 오래된 패널 정리
     * @return 저장된 패널
     */
    @Transactional
    public GalleryDto.PanelInfo save(GalleryDto.SaveRequest request) {
        if (isBlank(request.getScene()) || isBlank(request.getNarratorCaption()) || isBlank(request.getImageRef())) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "scene, narratorCaption and imageRef are required.");
        }

        SceneCategory sceneCategory = request.getSceneCategory() != null ? request.getSceneCategory() : SceneCategory.GENERAL;
        StyleCategory styleCategory = request.getStyleCategory() != null ? request.getStyleCategory() : StyleCategory.VIBRANT;

        SavedPanel panel = SavedPanel.builder()
                .scene(request.getScene().trim())
                .narratorCaption(request.getNarratorCaption().trim())
                .dialogue(request.getDialogue() != null ? request.getDialogue().trim() : "")
                .visualDescription(request.getVisualDescription())
                .imageRef(request.getImageRef().trim())
                .styleCategory(styleCategory.getCode())
                .sceneCategory(sceneCategory.getCode())
                .isFavorite(false)
                .createdAt(LocalDateTime.now(clock))
                .build();

        savedPanelMapper.insert(panel);
        log.info("[Gallery] Saved panel {}", panel.getPanelId());

        Long threshold = savedPanelMapper.findPruneThreshold(maxPanels);
        if (threshold != null) {
            int pruned = savedPanelMapper.deleteUpTo(threshold);
            log.info("[Gallery] Pruned {} panels beyond the newest {}", pruned, maxPanels);
        }

        return GalleryDto.PanelInfo.from(panel);
    }

    public List<GalleryDto.PanelInfo> list() {
        return savedPanelMapper.findAll().stream()
                .map(GalleryDto.PanelInfo::from)
                .toList();
    }

    @Transactional
    public void delete(Long panelId) {
        int deleted = savedPanelMapper.deleteById(panelId);
        if (deleted == 0) {
            throw new ApiException(ErrorCode.PANEL_NOT_FOUND);
        }
        log.info("[Gallery] Deleted panel {}", panelId);
    }

    /**
     * 즐겨찾기 토글
     * @return 변경된 패널
     */
    @Transactional
    public GalleryDto.PanelInfo toggleFavorite(Long panelId) {
        if (savedPanelMapper.toggleFavorite(panelId) == 0) {
            throw new ApiException(ErrorCode.PANEL_NOT_FOUND);
        }
        return savedPanelMapper.findById(panelId)
                .map(GalleryDto.PanelInfo::from)
                .orElseThrow(() -> new ApiException(ErrorCode.PANEL_NOT_FOUND));
    }

    public GalleryDto.Stats stats() {
        return GalleryDto.Stats.builder()
                .totalPanels(savedPanelMapper.countAll())
                .favoritePanels(savedPanelMapper.countFavorites())
                .maxPanels(maxPanels)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
