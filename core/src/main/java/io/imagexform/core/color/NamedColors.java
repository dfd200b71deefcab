package io.imagexform.core.color;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Named color table: the CSS/X11 color keywords plus the X11 {@code grayN} / {@code greyN}
 * ramp, where N in 0..100 is a percentage of full intensity.
 */
public final class NamedColors {

    private static final Pattern GRAY_RAMP = Pattern.compile("gr[ae]y(\\d{1,3})");
    private static final Map<String, Rgba> COLORS = new HashMap<>();

    static {
        COLORS.put("aliceblue", rgb(0xf0f8ff));
        COLORS.put("antiquewhite", rgb(0xfaebd7));
        COLORS.put("aqua", rgb(0x00ffff));
        COLORS.put("aquamarine", rgb(0x7fffd4));
        COLORS.put("azure", rgb(0xf0ffff));
        COLORS.put("beige", rgb(0xf5f5dc));
        COLORS.put("bisque", rgb(0xffe4c4));
        COLORS.put("black", rgb(0x000000));
        COLORS.put("blanchedalmond", rgb(0xffebcd));
        COLORS.put("blue", rgb(0x0000ff));
        COLORS.put("blueviolet", rgb(0x8a2be2));
        COLORS.put("brown", rgb(0xa52a2a));
        COLORS.put("burlywood", rgb(0xdeb887));
        COLORS.put("cadetblue", rgb(0x5f9ea0));
        COLORS.put("chartreuse", rgb(0x7fff00));
        COLORS.put("chocolate", rgb(0xd2691e));
        COLORS.put("coral", rgb(0xff7f50));
        COLORS.put("cornflowerblue", rgb(0x6495ed));
        COLORS.put("cornsilk", rgb(0xfff8dc));
        COLORS.put("crimson", rgb(0xdc143c));
        COLORS.put("cyan", rgb(0x00ffff));
        COLORS.put("darkblue", rgb(0x00008b));
        COLORS.put("darkcyan", rgb(0x008b8b));
        COLORS.put("darkgoldenrod", rgb(0xb8860b));
        COLORS.put("darkgray", rgb(0xa9a9a9));
        COLORS.put("darkgreen", rgb(0x006400));
        COLORS.put("darkgrey", rgb(0xa9a9a9));
        COLORS.put("darkkhaki", rgb(0xbdb76b));
        COLORS.put("darkmagenta", rgb(0x8b008b));
        COLORS.put("darkolivegreen", rgb(0x556b2f));
        COLORS.put("darkorange", rgb(0xff8c00));
        COLORS.put("darkorchid", rgb(0x9932cc));
        COLORS.put("darkred", rgb(0x8b0000));
        COLORS.put("darksalmon", rgb(0xe9967a));
        COLORS.put("darkseagreen", rgb(0x8fbc8f));
        COLORS.put("darkslateblue", rgb(0x483d8b));
        COLORS.put("darkslategray", rgb(0x2f4f4f));
        COLORS.put("darkslategrey", rgb(0x2f4f4f));
        COLORS.put("darkturquoise", rgb(0x00ced1));
        COLORS.put("darkviolet", rgb(0x9400d3));
        COLORS.put("deeppink", rgb(0xff1493));
        COLORS.put("deepskyblue", rgb(0x00bfff));
        COLORS.put("dimgray", rgb(0x696969));
        COLORS.put("dimgrey", rgb(0x696969));
        COLORS.put("dodgerblue", rgb(0x1e90ff));
        COLORS.put("firebrick", rgb(0xb22222));
        COLORS.put("floralwhite", rgb(0xfffaf0));
        COLORS.put("forestgreen", rgb(0x228b22));
        COLORS.put("fuchsia", rgb(0xff00ff));
        COLORS.put("gainsboro", rgb(0xdcdcdc));
        COLORS.put("ghostwhite", rgb(0xf8f8ff));
        COLORS.put("gold", rgb(0xffd700));
        COLORS.put("goldenrod", rgb(0xdaa520));
        COLORS.put("gray", rgb(0x808080));
        COLORS.put("green", rgb(0x008000));
        COLORS.put("greenyellow", rgb(0xadff2f));
        COLORS.put("grey", rgb(0x808080));
        COLORS.put("honeydew", rgb(0xf0fff0));
        COLORS.put("hotpink", rgb(0xff69b4));
        COLORS.put("indianred", rgb(0xcd5c5c));
        COLORS.put("indigo", rgb(0x4b0082));
        COLORS.put("ivory", rgb(0xfffff0));
        COLORS.put("khaki", rgb(0xf0e68c));
        COLORS.put("lavender", rgb(0xe6e6fa));
        COLORS.put("lavenderblush", rgb(0xfff0f5));
        COLORS.put("lawngreen", rgb(0x7cfc00));
        COLORS.put("lemonchiffon", rgb(0xfffacd));
        COLORS.put("lightblue", rgb(0xadd8e6));
        COLORS.put("lightcoral", rgb(0xf08080));
        COLORS.put("lightcyan", rgb(0xe0ffff));
        COLORS.put("lightgoldenrodyellow", rgb(0xfafad2));
        COLORS.put("lightgray", rgb(0xd3d3d3));
        COLORS.put("lightgreen", rgb(0x90ee90));
        COLORS.put("lightgrey", rgb(0xd3d3d3));
        COLORS.put("lightpink", rgb(0xffb6c1));
        COLORS.put("lightsalmon", rgb(0xffa07a));
        COLORS.put("lightseagreen", rgb(0x20b2aa));
        COLORS.put("lightskyblue", rgb(0x87cefa));
        COLORS.put("lightslategray", rgb(0x778899));
        COLORS.put("lightslategrey", rgb(0x778899));
        COLORS.put("lightsteelblue", rgb(0xb0c4de));
        COLORS.put("lightyellow", rgb(0xffffe0));
        COLORS.put("lime", rgb(0x00ff00));
        COLORS.put("limegreen", rgb(0x32cd32));
        COLORS.put("linen", rgb(0xfaf0e6));
        COLORS.put("magenta", rgb(0xff00ff));
        COLORS.put("maroon", rgb(0x800000));
        COLORS.put("mediumaquamarine", rgb(0x66cdaa));
        COLORS.put("mediumblue", rgb(0x0000cd));
        COLORS.put("mediumorchid", rgb(0xba55d3));
        COLORS.put("mediumpurple", rgb(0x9370db));
        COLORS.put("mediumseagreen", rgb(0x3cb371));
        COLORS.put("mediumslateblue", rgb(0x7b68ee));
        COLORS.put("mediumspringgreen", rgb(0x00fa9a));
        COLORS.put("mediumturquoise", rgb(0x48d1cc));
        COLORS.put("mediumvioletred", rgb(0xc71585));
        COLORS.put("midnightblue", rgb(0x191970));
        COLORS.put("mintcream", rgb(0xf5fffa));
        COLORS.put("mistyrose", rgb(0xffe4e1));
        COLORS.put("moccasin", rgb(0xffe4b5));
        COLORS.put("navajowhite", rgb(0xffdead));
        COLORS.put("navy", rgb(0x000080));
        COLORS.put("oldlace", rgb(0xfdf5e6));
        COLORS.put("olive", rgb(0x808000));
        COLORS.put("olivedrab", rgb(0x6b8e23));
        COLORS.put("orange", rgb(0xffa500));
        COLORS.put("orangered", rgb(0xff4500));
        COLORS.put("orchid", rgb(0xda70d6));
        COLORS.put("palegoldenrod", rgb(0xeee8aa));
        COLORS.put("palegreen", rgb(0x98fb98));
        COLORS.put("paleturquoise", rgb(0xafeeee));
        COLORS.put("palevioletred", rgb(0xdb7093));
        COLORS.put("papayawhip", rgb(0xffefd5));
        COLORS.put("peachpuff", rgb(0xffdab9));
        COLORS.put("peru", rgb(0xcd853f));
        COLORS.put("pink", rgb(0xffc0cb));
        COLORS.put("plum", rgb(0xdda0dd));
        COLORS.put("powderblue", rgb(0xb0e0e6));
        COLORS.put("purple", rgb(0x800080));
        COLORS.put("rebeccapurple", rgb(0x663399));
        COLORS.put("red", rgb(0xff0000));
        COLORS.put("rosybrown", rgb(0xbc8f8f));
        COLORS.put("royalblue", rgb(0x4169e1));
        COLORS.put("saddlebrown", rgb(0x8b4513));
        COLORS.put("salmon", rgb(0xfa8072));
        COLORS.put("sandybrown", rgb(0xf4a460));
        COLORS.put("seagreen", rgb(0x2e8b57));
        COLORS.put("seashell", rgb(0xfff5ee));
        COLORS.put("sienna", rgb(0xa0522d));
        COLORS.put("silver", rgb(0xc0c0c0));
        COLORS.put("skyblue", rgb(0x87ceeb));
        COLORS.put("slateblue", rgb(0x6a5acd));
        COLORS.put("slategray", rgb(0x708090));
        COLORS.put("slategrey", rgb(0x708090));
        COLORS.put("snow", rgb(0xfffafa));
        COLORS.put("springgreen", rgb(0x00ff7f));
        COLORS.put("steelblue", rgb(0x4682b4));
        COLORS.put("tan", rgb(0xd2b48c));
        COLORS.put("teal", rgb(0x008080));
        COLORS.put("thistle", rgb(0xd8bfd8));
        COLORS.put("tomato", rgb(0xff6347));
        COLORS.put("turquoise", rgb(0x40e0d0));
        COLORS.put("violet", rgb(0xee82ee));
        COLORS.put("wheat", rgb(0xf5deb3));
        COLORS.put("white", rgb(0xffffff));
        COLORS.put("whitesmoke", rgb(0xf5f5f5));
        COLORS.put("yellow", rgb(0xffff00));
        COLORS.put("yellowgreen", rgb(0x9acd32));
    }

    private NamedColors() {
        // utility class
    }

    /**
     * Looks up a color name. Matching ignores case, spaces and underscores, so {@code "Dark Blue"}
     * and {@code "dark_blue"} both resolve to {@code darkblue}.
     */
    public static Optional<Rgba> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.trim().toLowerCase(Locale.ROOT).replace(" ", "").replace("_", "");
        Rgba color = COLORS.get(key);
        if (color != null) {
            return Optional.of(color);
        }
        Matcher ramp = GRAY_RAMP.matcher(key);
        if (ramp.matches()) {
            int percent = Integer.parseInt(ramp.group(1));
            if (percent <= 100) {
                int level = (int) Math.round(percent * 255 / 100.0);
                return Optional.of(Rgba.opaque(level, level, level));
            }
        }
        return Optional.empty();
    }

    private static Rgba rgb(int packed) {
        return Rgba.opaque((packed >> 16) & 0xFF, (packed >> 8) & 0xFF, packed & 0xFF);
    }
}
