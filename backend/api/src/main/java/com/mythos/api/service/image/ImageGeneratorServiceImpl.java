package com.mythos.api.service.image;

import com.mythos.api.service.provider.GenerationProvider;
import com.mythos.api.service.provider.ImagePrompt;
import com.mythos.common.enums.SceneCategory;
import com.mythos.common.enums.StyleCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ImageGeneratorServiceImpl implements ImageGeneratorService {

    private final GenerationProvider generationProvider;
    private final ImagePromptBuilder promptBuilder;

    @Override
    public ImageResult generate(String visualDescription, StyleCategory style, SceneCategory category) {
        ImagePrompt prompt = promptBuilder.build(visualDescription, style, category);
        log.info("[Image] Generating - style: {}, category: {}, prompt length: {}",
                style.getCode(), category.getCode(), prompt.getPrompt().length());

        String imageRef = generationProvider.synthesizeImage(prompt, style);

        log.info("[Image] Generated image reference ({} mode)", generationProvider.getMode().getCode());
        return ImageResult.builder()
                .imageRef(imageRef)
                .prompt(prompt.getPrompt())
                .build();
    }
}
