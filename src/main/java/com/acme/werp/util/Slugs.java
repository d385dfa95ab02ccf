package com.acme.werp.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/** Record identity derived from a vessel name. */
public final class Slugs {
    private Slugs() {}

    public static final int MAX_LENGTH = 50;

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_DASHES = Pattern.compile("(^-+|-+$)");

    public static String fromVesselName(String name) {
        if (name == null) return "";
        String s = Normalizer.normalize(name.toLowerCase(Locale.ROOT), Normalizer.Form.NFKD);
        s = COMBINING_MARKS.matcher(s).replaceAll("");
        s = NON_ALNUM.matcher(s).replaceAll("-");
        s = EDGE_DASHES.matcher(s).replaceAll("");
        if (s.length() > MAX_LENGTH) s = EDGE_DASHES.matcher(s.substring(0, MAX_LENGTH)).replaceAll("");
        return s;
    }
}
