package com.purchasingpower.thesugraph.model.style;

/**
 * Fill and border colour pair.
 */
public record Palette(String fill, String border) {

    public static final Palette THESIS = new Palette("#f0faf0", "#82b366");
    public static final Palette THESIS_UNSTATED = new Palette("#fcfffd", "#666666");
    public static final Palette MISC = new Palette("#ecd4bb", "#b39c84");
    public static final Palette MISC_UNSTATED = new Palette("#f6ede6", "#b3a89a");
    public static final Palette PROPOSITION = new Palette("#f9edff", "#9673a6");
    public static final Palette ETIOLOGY = new Palette("#e0ffff", "#008b8b");
    public static final Palette ANALOGY = new Palette("#ffffd0", "#d4d400");
    public static final Palette REFERENCE = new Palette("#f0f3e0", "#708238");
    public static final Palette EMPLOYED = new Palette("#ffe6cc", "#d79c02");
    public static final Palette UNSPECIFIED = new Palette("#f5f5f5", "#a0a0a0");
    public static final Palette PHASE_UNMATCHED = new Palette("#c1d5c2", "#a2b9a3");
    public static final Palette SUPPORT_DEFAULT = new Palette("#dae8fc", "#7c9ac7");
    public static final Palette TARGET_DEFAULT = new Palette("#ffffff", "#000000");

    /**
     * Linear blend towards {@code other}, biased by the square root of {@code ratio} so that a
     * few matches already move the colour noticeably.
     */
    public Palette blend(Palette other, double ratio) {
        double biased = Math.sqrt(Math.max(0.0, Math.min(1.0, ratio)));
        return new Palette(blend(fill, other.fill, biased), blend(border, other.border, biased));
    }

    private static String blend(String from, String to, double ratio) {
        int[] a = rgb(from);
        int[] b = rgb(to);
        StringBuilder sb = new StringBuilder("#");
        for (int i = 0; i < 3; i++) {
            int channel = (int) (a[i] + (b[i] - a[i]) * ratio);
            sb.append(String.format("%02x", channel));
        }
        return sb.toString();
    }

    private static int[] rgb(String hex) {
        String value = hex.startsWith("#") ? hex.substring(1) : hex;
        return new int[]{
                Integer.parseInt(value.substring(0, 2), 16),
                Integer.parseInt(value.substring(2, 4), 16),
                Integer.parseInt(value.substring(4, 6), 16)
        };
    }
}
