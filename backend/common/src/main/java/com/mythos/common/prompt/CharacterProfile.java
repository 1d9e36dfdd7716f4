package com.mythos.common.prompt;

import lombok.Getter;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 신화 캐릭터 프로필 (외형/무기/탈것/문화적 맥락)
 * 이미지 프롬프트의 캐릭터 스타일링 조각과 품질 검증의 캐릭터 인식에 사용
 *
 * 선언 순서가 곧 인식 우선순위 (한 장면에 여러 캐릭터가 있으면 먼저 선언된 캐릭터)
 */
@Getter
public enum CharacterProfile {

    KRISHNA("Krishna",
            List.of("krishna", "krishn", "kanha", "gopal", "madhava", "govinda"),
            "dark blue skin, peacock feather crown, yellow silk garments",
            List.of("dark blue skin", "peacock feather crown", "yellow silk garments", "golden ornaments",
                    "lotus flower", "flute", "cowherd attire", "divine aura", "youthful appearance"),
            List.of("sudarshana chakra", "kaumodaki mace", "sharanga bow", "nandaka sword"),
            List.of("garuda", "eagle"),
            List.of("divine", "youthful", "playful", "majestic", "pastoral"),
            List.of("vaishnavism", "bhakti", "gita", "mathura", "vrindavan")),

    HANUMAN("Hanuman",
            List.of("hanuman", "hanumant", "anjani", "maruti", "pavanasuta"),
            "orange fur, muscular build, devotional expression",
            List.of("orange fur", "muscular build", "long tail", "devotional expression",
                    "rudraksha beads", "sacred thread", "monkey form", "divine strength"),
            List.of("gada", "mace", "divine power"),
            List.of("clouds", "wind"),
            List.of("devotional", "powerful", "loyal", "monkey", "strength"),
            List.of("ramayana", "vaishnavism", "bhakti", "devotion")),

    SHIVA("Shiva",
            List.of("shiva", "mahadeva", "rudra", "bholenath", "shankar", "trilokinath"),
            "ash-covered skin, third eye, serpents, tiger skin",
            List.of("ash-covered skin", "third eye", "serpents around neck", "tiger skin",
                    "matted hair", "crescent moon", "trident", "damru", "blue throat"),
            List.of("trishula", "damru", "pinaka bow", "parashu axe"),
            List.of("nandi", "bull"),
            List.of("ascetic", "destroyer", "yogi", "cosmic", "mystical"),
            List.of("shaivism", "yoga", "meditation", "kailash", "destruction")),

    DURGA("Durga",
            List.of("durga", "devi", "shakti", "ambika", "chandi"),
            "multiple arms, various weapons, riding a tiger/lion",
            List.of("multiple arms", "various weapons", "riding tiger/lion", "beautiful form",
                    "divine radiance", "warrior goddess", "protective mother", "fierce expression"),
            List.of("trishula", "sword", "bow", "arrow", "chakra", "conch"),
            List.of("tiger", "lion"),
            List.of("warrior", "protective", "fierce", "beautiful", "divine"),
            List.of("shaktism", "navratri", "protection", "feminine power")),

    RAMA("Rama",
            List.of("rama", "ram", "ramachandra", "maryada purushottam"),
            "noble bearing, bow and arrows, royal garments",
            List.of("noble bearing", "bow and arrows", "royal garments", "crown",
                    "divine aura", "righteous king", "blue skin", "lotus eyes"),
            List.of("kodanda bow", "arrows", "sword"),
            List.of("pushpaka vimana", "chariot"),
            List.of("noble", "righteous", "royal", "warrior", "ideal"),
            List.of("ramayana", "dharma", "righteousness", "ayodhya")),

    GANESHA("Ganesha",
            List.of("ganesha", "ganesh", "ganapati", "vighnaharta", "ekadanta"),
            "elephant head, rotund belly, mouse companion",
            List.of("elephant head", "rotund belly", "mouse companion", "modak sweets",
                    "broken tusk", "trunk", "large ears", "auspicious form"),
            List.of("axe", "noose", "goad"),
            List.of("mouse", "rat"),
            List.of("auspicious", "wise", "remover of obstacles", "elephant", "beloved"),
            List.of("ganesh chaturthi", "auspicious beginnings", "wisdom", "success")),

    ARJUNA("Arjuna",
            List.of("arjuna", "arjun", "phalguna", "kiriti", "savyasachi"),
            "handsome warrior, gandiva bow, gleaming armor",
            List.of("handsome warrior", "bow and arrows", "armor", "crown",
                    "divine chariot", "krishna as charioteer", "white horses"),
            List.of("gandiva bow", "celestial arrows", "sword", "mace"),
            List.of("divine chariot"),
            List.of("warrior", "archer", "noble", "skilled", "divine"),
            List.of("mahabharata", "kurukshetra", "gita", "archery")),

    SITA("Sita",
            List.of("sita", "janaki", "vaidehi"),
            "golden complexion, lotus eyes, royal garments",
            List.of("beautiful form", "golden complexion", "lotus eyes", "royal garments",
                    "divine beauty", "lotus flower", "golden ornaments"),
            List.of("divine power"),
            List.of("pushpaka vimana"),
            List.of("beautiful", "virtuous", "royal", "divine", "feminine"),
            List.of("ramayana", "virtue", "ayodhya", "feminine power"));

    private final String displayName;
    private final List<String> aliases;
    private final String imageStyle;
    private final List<String> appearance;
    private final List<String> weapons;
    private final List<String> vehicles;
    private final List<String> styleKeywords;
    private final List<String> culturalContext;
    private final Pattern aliasPattern;

    CharacterProfile(String displayName, List<String> aliases, String imageStyle, List<String> appearance,
                     List<String> weapons, List<String> vehicles, List<String> styleKeywords,
                     List<String> culturalContext) {
        this.displayName = displayName;
        this.aliases = aliases;
        this.imageStyle = imageStyle;
        this.appearance = appearance;
        this.weapons = weapons;
        this.vehicles = vehicles;
        this.styleKeywords = styleKeywords;
        this.culturalContext = culturalContext;
        // 부분 문자열 오탐 방지 ("ram" ⊂ "dramatic")
        this.aliasPattern = Pattern.compile("\\b(" + String.join("|", aliases) + ")\\b");
    }

    public boolean mentionedIn(String text) {
        return text != null && aliasPattern.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    /**
     * 텍스트에서 첫 번째로 인식되는 캐릭터
     */
    public static Optional<CharacterProfile> recognize(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (CharacterProfile profile : values()) {
            if (profile.mentionedIn(text)) {
                return Optional.of(profile);
            }
        }
        return Optional.empty();
    }
}
