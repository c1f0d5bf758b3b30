package com.vcalc.latex.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Options carried on the first line of a calculation block:
 *
 *   # vcalc: id=abc12345 vset=main hidden accent=vset bg=subtle compact
 *
 * Every option is optional. Without an options line the block keeps its
 * full code and all options are unset.
 */
public final class BlockOptions {

    public static final String PREFIX = "# vcalc:";

    private static final Pattern ID = Pattern.compile("\\bid=(\\w+)");
    private static final Pattern VSET = Pattern.compile("\\bvset=(\\w+)");
    private static final Pattern ACCENT = Pattern.compile("\\baccent=(\\w+)");
    private static final Pattern BG = Pattern.compile("\\bbg=(\\w+)");
    private static final Pattern HIDDEN = Pattern.compile("\\bhidden\\b");
    private static final Pattern COMPACT = Pattern.compile("\\bcompact\\b");

    private final String id;
    private final String code;
    private final String vset;
    private final boolean hidden;
    private final Boolean accentVset;
    private final String bgStyle;
    private final Boolean compact;

    /**
     * @param accentVset true to follow the vset color, false for the default accent, null for the global setting
     * @param bgStyle    {@code transparent}, {@code subtle}, {@code solid}, or null for the global setting
     * @param compact    null for the global setting
     */
    public BlockOptions(String id, String code, String vset, boolean hidden,
                        Boolean accentVset, String bgStyle, Boolean compact) {
        this.id = id;
        this.code = (code == null) ? "" : code;
        this.vset = vset;
        this.hidden = hidden;
        this.accentVset = accentVset;
        this.bgStyle = bgStyle;
        this.compact = compact;
    }

    public static BlockOptions parse(String block) {
        String text = (block == null) ? "" : block;
        int nl = text.indexOf('\n');
        String first = (nl < 0 ? text : text.substring(0, nl)).trim();
        if (!first.startsWith(PREFIX)) {
            return new BlockOptions(null, text, null, false, null, null, null);
        }

        String opts = first.substring(PREFIX.length()).trim();
        String accent = group(ACCENT, opts);
        return new BlockOptions(
                group(ID, opts),
                (nl < 0) ? "" : text.substring(nl + 1),
                group(VSET, opts),
                HIDDEN.matcher(opts).find(),
                (accent == null) ? null : accent.equals("vset"),
                group(BG, opts),
                COMPACT.matcher(opts).find() ? Boolean.TRUE : null);
    }

    private static String group(Pattern p, String s) {
        Matcher m = p.matcher(s);
        return m.find() ? m.group(1) : null;
    }

    /** The canonical options line; requires an id. */
    public String buildOptionsLine() {
        if (id == null || id.isEmpty()) throw new IllegalStateException("block id is required for an options line");
        List<String> parts = new ArrayList<>();
        parts.add("id=" + id);
        if (vset != null && !vset.isEmpty()) parts.add("vset=" + vset);
        if (hidden) parts.add("hidden");
        if (accentVset != null) parts.add("accent=" + (accentVset ? "vset" : "default"));
        if (bgStyle != null && !bgStyle.isEmpty()) parts.add("bg=" + bgStyle);
        if (Boolean.TRUE.equals(compact)) parts.add("compact");
        return PREFIX + " " + String.join(" ", parts);
    }

    public BlockOptions withId(String newId) {
        return new BlockOptions(newId, code, vset, hidden, accentVset, bgStyle, compact);
    }

    public String id() { return id; }
    public String code() { return code; }
    public String vset() { return vset; }
    public boolean hidden() { return hidden; }
    public Boolean accentVset() { return accentVset; }
    public String bgStyle() { return bgStyle; }
    public Boolean compact() { return compact; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockOptions)) return false;
        BlockOptions b = (BlockOptions) o;
        return hidden == b.hidden
                && Objects.equals(id, b.id)
                && code.equals(b.code)
                && Objects.equals(vset, b.vset)
                && Objects.equals(accentVset, b.accentVset)
                && Objects.equals(bgStyle, b.bgStyle)
                && Objects.equals(compact, b.compact);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, code, vset, hidden, accentVset, bgStyle, compact);
    }

    @Override
    public String toString() {
        return "BlockOptions{id=" + id + ", vset=" + vset + ", hidden=" + hidden
                + ", accentVset=" + accentVset + ", bgStyle=" + bgStyle + ", compact=" + compact + "}";
    }
}
