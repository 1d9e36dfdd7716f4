package com.mythos.api.mapper;

import com.mythos.api.entity.SavedPanel;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

/**
 * 갤러리 패널 매퍼
 */
@Mapper
public interface SavedPanelMapper {

    /**
     * 패널 저장 (panelId 자동 생성)
     */
    void insert(SavedPanel panel);

    Optional<SavedPanel> findById(@Param("panelId") Long panelId);

    /**
     * 최신순 전체 조회
     */
    List<SavedPanel> findAll();

    int deleteById(@Param("panelId") Long panelId);

    int toggleFavorite(@Param("panelId") Long panelId);

    // ========== 보관 개수 제한 ==========

    /**
     * 최신 keep개 다음으로 오래된 패널의 ID (없으면 null)
     */
    Long findPruneThreshold(@Param("keep") int keep);

    /**
     * ID가 기준값 이하인 패널 삭제
     */
    int deleteUpTo(@Param("panelId") Long panelId);

    // ========== 통계 ==========

    long countAll();

    long countFavorites();
}
