package io.github.hongjungwan.redlog.api.theme;

/**
 * ANSI SGR 색상 코드. {@link #NONE}은 색상 없음.
 */
public enum AnsiColor {

    NONE(0),

    RED(31),
    GREEN(32),
    YELLOW(33),
    BLUE(34),
    MAGENTA(35),
    CYAN(36),
    WHITE(37),
    BRIGHT_BLACK(90),
    BRIGHT_RED(91),
    BRIGHT_GREEN(92),
    BRIGHT_YELLOW(93),
    BRIGHT_BLUE(94),
    BRIGHT_MAGENTA(95),
    BRIGHT_CYAN(96),
    BRIGHT_WHITE(97),

    ON_RED(41),
    ON_GREEN(42),
    ON_YELLOW(43),
    ON_BLUE(44),
    ON_MAGENTA(45),
    ON_CYAN(46),
    ON_WHITE(47),
    ON_GRAY(100),
    ON_BRIGHT_RED(101),
    ON_BRIGHT_GREEN(102),
    ON_BRIGHT_YELLOW(103),
    ON_BRIGHT_BLUE(104),
    ON_BRIGHT_MAGENTA(105),
    ON_BRIGHT_CYAN(106),
    ON_BRIGHT_WHITE(107);

    public static final String ESCAPE = "\u001B[";
    public static final String RESET = ESCAPE + "0m";

    private final int code;

    AnsiColor(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isNone() {
        return this == NONE;
    }

    /**
     * 전경/배경색 적용. 둘 다 NONE이면 원문 그대로.
     */
    public static String apply(String text, AnsiColor foreground, AnsiColor background) {
        boolean hasFg = foreground != null && !foreground.isNone();
        boolean hasBg = background != null && !background.isNone();
        if (!hasFg && !hasBg) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length() + 16).append(ESCAPE);
        if (hasFg) {
            sb.append(foreground.code);
        }
        if (hasBg) {
            if (hasFg) {
                sb.append(';');
            }
            sb.append(background.code);
        }
        return sb.append('m').append(text).append(RESET).toString();
    }
}
