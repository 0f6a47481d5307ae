package work.geodsl.command;

import java.util.Locale;
import java.util.Optional;

/**
 * Command sub-sets as presented to users.
 */
public enum CommandCategory {
    GEOMETRY("Geometry"),
    ALGEBRA("Algebra"),
    STATISTICS("Statistics"),
    PROBABILITY("Probability"),
    FUNCTION("Functions and Calculus"),
    CONIC("Conic"),
    LIST("List"),
    VECTOR("Vector and Matrix"),
    TRANSFORMATION("Transformation"),
    CHARTS("Charts"),
    TEXT("Text"),
    LOGICAL("Logical"),
    SCRIPTING("Scripting"),
    DISCRETE("Discrete Math"),
    GEOGEBRA("GeoGebra"),
    OPTIMIZATION("Optimization"),
    CAS("CAS"),
    THREE_D("3D"),
    FINANCIAL("Financial"),
    ENGLISH("English");

    private final String displayName;

    CommandCategory(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Accepts either the display name ({@code "Vector and Matrix"}) or the constant name
     * ({@code "vector"}), case-insensitively.
     */
    public static Optional<CommandCategory> fromName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (CommandCategory category : values()) {
            if (category.displayName.equalsIgnoreCase(trimmed)
                || category.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
