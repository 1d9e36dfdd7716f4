package com.mythos.api.controller;

import com.mythos.api.dto.GalleryDto;
import com.mythos.api.service.gallery.GalleryService;
import com.mythos.common.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/panels")
@Tag(name = "Gallery", description = "저장된 패널 갤러리 API")
public class GalleryController {

    private final GalleryService galleryService;

    @GetMapping
    @Operation(summary = "패널 목록", description = "저장된 패널을 최신순으로 조회합니다.")
    public ApiResponse<List<GalleryDto.PanelInfo>> list() {
        return ApiResponse.success(galleryService.list());
    }

    @PostMapping
    @Operation(summary = "패널 저장", description = "완성된 패널을 갤러리에 저장합니다.")
    public ApiResponse<GalleryDto.PanelInfo> save(@RequestBody GalleryDto.SaveRequest request) {
        return ApiResponse.success("Panel saved", galleryService.save(request));
    }

    @DeleteMapping("/{panelId}")
    @Operation(summary = "패널 삭제")
    public ApiResponse<Void> delete(@PathVariable Long panelId) {
        galleryService.delete(panelId);
        return ApiResponse.success("Panel deleted", null);
    }

    @PostMapping("/{panelId}/favorite")
    @Operation(summary = "즐겨찾기 토글")
    public ApiResponse<GalleryDto.PanelInfo> toggleFavorite(@PathVariable Long panelId) {
        return ApiResponse.success(galleryService.toggleFavorite(panelId));
    }

    @GetMapping("/stats")
    @Operation(summary = "갤러리 통계", description = "저장 개수, 즐겨찾기 개수, 최대 보관 개수를 반환합니다.")
    public ApiResponse<GalleryDto.Stats> stats() {
        return ApiResponse.success(galleryService.stats());
    }
}
