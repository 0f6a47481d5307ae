package work.geodsl.config;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import work.geodsl.command.CommandCategory;

/**
 * Immutable policy settings a kernel is started with.
 *
 * @param examMode only {@code allowedCommands} may run
 * @param allowedCommands display names honoured in exam mode
 * @param casAllowed when false the CAS category is blocked
 * @param blockedCategories further categories blocked outright
 * @param allowRedefinition when false rebinding a label fails with a name-used error
 * @param checkArgumentTypes install the per-position argument shape filter
 * @param maxArguments global cap on argument count, {@code 0} for none
 * @param logLevel threshold for the simple logging binding
 */
public record KernelConfiguration(
    boolean examMode,
    Set<String> allowedCommands,
    boolean casAllowed,
    Set<CommandCategory> blockedCategories,
    boolean allowRedefinition,
    boolean checkArgumentTypes,
    int maxArguments,
    LogLevel logLevel
) {
    public KernelConfiguration {
        allowedCommands = Set.copyOf(Objects.requireNonNull(allowedCommands, "allowedCommands"));
        blockedCategories = Set.copyOf(Objects.requireNonNull(blockedCategories, "blockedCategories"));
        Objects.requireNonNull(logLevel, "logLevel");
        if (maxArguments < 0) {
            throw new IllegalArgumentException("maxArguments must not be negative");
        }
    }

    public static KernelConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .examMode(examMode)
            .allowedCommands(allowedCommands)
            .casAllowed(casAllowed)
            .blockedCategories(blockedCategories)
            .allowRedefinition(allowRedefinition)
            .checkArgumentTypes(checkArgumentTypes)
            .maxArguments(maxArguments)
            .logLevel(logLevel);
    }

    public static final class Builder {
        private boolean examMode;
        private Set<String> allowedCommands = new LinkedHashSet<>();
        private boolean casAllowed;
        private Set<CommandCategory> blockedCategories = EnumSet.noneOf(CommandCategory.class);
        private boolean allowRedefinition = true;
        private boolean checkArgumentTypes = true;
        private int maxArguments;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder examMode(boolean examMode) {
            this.examMode = examMode;
            return this;
        }

        public Builder allowedCommands(Collection<String> allowedCommands) {
            this.allowedCommands = new LinkedHashSet<>(allowedCommands);
            return this;
        }

        public Builder casAllowed(boolean casAllowed) {
            this.casAllowed = casAllowed;
            return this;
        }

        public Builder blockedCategories(Collection<CommandCategory> blockedCategories) {
            this.blockedCategories = blockedCategories.isEmpty()
                ? EnumSet.noneOf(CommandCategory.class)
                : EnumSet.copyOf(blockedCategories);
            return this;
        }

        public Builder allowRedefinition(boolean allowRedefinition) {
            this.allowRedefinition = allowRedefinition;
            return this;
        }

        public Builder checkArgumentTypes(boolean checkArgumentTypes) {
            this.checkArgumentTypes = checkArgumentTypes;
            return this;
        }

        public Builder maxArguments(int maxArguments) {
            this.maxArguments = maxArguments;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public KernelConfiguration build() {
            return new KernelConfiguration(
                examMode,
                allowedCommands,
                casAllowed,
                blockedCategories,
                allowRedefinition,
                checkArgumentTypes,
                maxArguments,
                logLevel
            );
        }
    }
}
