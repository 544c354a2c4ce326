package org.energybench.leaderboard.model;

import java.util.Objects;

/**
 * One entry of a task's model-type filter: the category label with its badge.
 */
public final class CategoryOption {

    private final String label;
    private final String icon;
    private final String description;

    public CategoryOption(String label, String icon, String description) {
        this.label = Objects.requireNonNull(label, "Label cannot be null");
        this.icon = Objects.requireNonNull(icon, "Icon cannot be null");
        this.description = description;
    }

    public static CategoryOption of(String label) {
        return ModelCategory.fromLabel(label)
            .map(c -> new CategoryOption(c.getLabel(), c.getIcon(), c.getDescription()))
            .orElseGet(() -> new CategoryOption(label, ModelCategory.UNKNOWN_ICON, null));
    }

    public String getLabel() {
        return label;
    }

    public String getIcon() {
        return icon;
    }

    /** Legend text; {@code null} for categories outside the known table. */
    public String getDescription() {
        return description;
    }

    /** Checkbox caption, badge followed by label. */
    public String getCaption() {
        return icon + " " + label;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        CategoryOption that = (CategoryOption) obj;
        return label.equals(that.label) && icon.equals(that.icon) && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, icon, description);
    }

    @Override
    public String toString() {
        return getCaption();
    }
}
