package com.mythos.api.service.provider;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Synthetic 모드용 고정 스크립트
 */
@Getter
@RequiredArgsConstructor
public enum SyntheticScript {

    KRISHNA_GOVARDHAN(
            "With divine strength, Lord Krishna lifts the mighty Govardhan Hill to protect his devotees.",
            "Fear not, my children!",
            "Krishna in his blue form holds up the massive Govardhan Hill with one finger, while villagers and animals shelter beneath. His face radiates divine protection and love. The scene shows the contrast between the massive mountain and the small figure beneath it."),

    KRISHNA_FLUTE(
            "Lord Krishna's divine flute calls forth the magic of creation itself.",
            "Come, let us dance!",
            "Krishna in his characteristic blue form plays a golden flute, surrounded by mesmerized devotees and animals. His peacock feather crown gleams, and the scene is filled with divine music notes and ethereal light."),

    RAMA_BOW(
            "Prince Rama's mighty strength shatters the divine bow, proving his worthiness.",
            "For Sita's hand!",
            "Rama in royal attire stands before the broken pieces of Shiva's divine bow. His face shows determination and divine power. The scene includes amazed onlookers and Sita watching with admiration. Golden light surrounds the moment of triumph."),

    RAMA_ARROW(
            "Prince Rama's arrow flies true, guided by dharma and divine purpose.",
            "For justice and truth!",
            "Rama in royal attire draws his mighty bow, aiming with perfect focus. His face shows determination and righteousness. The arrow glows with divine energy, and the background shows a forest setting with his loyal companions."),

    HANUMAN_LEAP(
            "Hanuman's mighty leap carries him across the vast ocean, mountain in hand.",
            "For Lord Rama!",
            "Hanuman in his orange form leaps dramatically across the ocean, carrying the Dronagiri mountain. His face shows determination and devotion. The scene captures the dynamic movement with wind effects and ocean waves below."),

    SHIVA_THIRD_EYE(
            "Shiva's third eye opens, unleashing cosmic destruction upon the universe.",
            "Enough!",
            "Shiva with his third eye open, radiating destructive cosmic energy. His face shows divine fury and power. The scene includes ash-covered body, serpents, and cosmic destruction effects. The background shows the universe being consumed by divine fire."),

    DURGA_MAHISHASURA(
            "Goddess Durga's divine weapons strike down the buffalo demon Mahishasura.",
            "Evil shall not prevail!",
            "Durga with multiple arms wielding various divine weapons, riding her lion mount. Her face shows divine fury and determination. The scene shows the demon Mahishasura being defeated, with divine light and weapon effects."),

    GANESHA_SCRIBE(
            "Ganesha's wisdom flows as he writes the great epic, guided by Vyasa's words.",
            "The story unfolds...",
            "Ganesha with his elephant head sits writing, while Vyasa dictates the Mahabharata. His mouse companion sits nearby. The scene shows ancient scrolls, divine wisdom, and the sacred act of preserving knowledge."),

    MEDITATION(
            "In the sacred grove, the seeker's soul transcends mortal boundaries, touched by divine wisdom.",
            "I see the truth now...",
            "A serene figure in white robes sits in meditation pose within a mystical forest. Divine light streams down from above, illuminating their peaceful expression. Sacred symbols float in the air around them, and ancient trees form a natural temple."),

    WARRIOR(
            "With divine fury coursing through his veins, the warrior stands resolute against the demonic horde.",
            "I shall not yield!",
            "A muscular warrior in traditional Indian armor stands defiantly, wielding a glowing divine weapon. His face shows determination and divine radiance. Behind him, a dark demonic army approaches. The scene is bathed in golden light with dramatic shadows."),

    GENERAL(
            "The ancient tale unfolds as destiny weaves its intricate pattern through the fabric of time.",
            "So it begins...",
            "A majestic figure in traditional Indian attire stands before a grand temple. Their pose conveys wisdom and authority. The background shows intricate architectural details and mystical symbols. Soft lighting creates an atmosphere of reverence."),

    // 구조 검증 실패 시 대체 스크립트
    FALLBACK(
            "The ancient tale unfolds as destiny weaves its intricate pattern.",
            "So it begins...",
            "A majestic figure in traditional Indian attire stands before a grand temple with intricate architectural details and mystical symbols.");

    private final String narration;
    private final String dialogue;
    private final String visualDescription;
}
