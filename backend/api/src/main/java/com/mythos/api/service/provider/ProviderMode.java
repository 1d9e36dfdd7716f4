package com.mythos.api.service.provider;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ProviderMode {
    LIVE("live"),
    SYNTHETIC("synthetic");

    private final String code;
}
