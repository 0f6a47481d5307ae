package work.geodsl.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.geodsl.command.CommandCategory;
import work.geodsl.command.CommandTable;

/**
 * Reads {@link KernelConfiguration} from TOML:
 *
 * <pre>
 * [kernel]
 * allowRedefinition = true
 * checkArgumentTypes = true
 * maxArguments = 10
 * logLevel = "info"
 *
 * [filters]
 * examMode = true
 * allowedCommands = ["Point", "Line"]
 * casAllowed = false
 * blockedCategories = ["Probability"]
 * </pre>
 */
public final class KernelConfigurationLoader {
    private KernelConfigurationLoader() {}

    /**
     * Missing files yield the defaults; unreadable or invalid files fail.
     */
    public static KernelConfiguration load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return KernelConfiguration.defaults();
        }
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read configuration " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static KernelConfiguration parse(String text) {
        TomlParseResult result = Toml.parse(text == null ? "" : text);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid configuration: " + result.errors().get(0).toString());
        }
        try {
            return fromToml(result);
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid configuration: " + ex.getMessage(), ex);
        }
    }

    private static KernelConfiguration fromToml(TomlParseResult result) {
        var builder = KernelConfiguration.builder();
        TomlTable kernel = result.getTable("kernel");
        if (kernel != null) {
            bool(kernel, "allowRedefinition").ifPresent(builder::allowRedefinition);
            bool(kernel, "checkArgumentTypes").ifPresent(builder::checkArgumentTypes);
            Long maxArguments = kernel.getLong("maxArguments");
            if (maxArguments != null) {
                builder.maxArguments(Math.toIntExact(maxArguments));
            }
            String logLevel = kernel.getString("logLevel");
            if (logLevel != null) {
                builder.logLevel(LogLevel.from(logLevel));
            }
        }

        TomlTable filters = result.getTable("filters");
        if (filters != null) {
            bool(filters, "examMode").ifPresent(builder::examMode);
            bool(filters, "casAllowed").ifPresent(builder::casAllowed);
            List<String> allowed = strings(filters.getArray("allowedCommands"));
            CommandTable table = CommandTable.standard();
            List<String> unknown = allowed.stream().filter(name -> !table.contains(name)).collect(Collectors.toList());
            if (!unknown.isEmpty()) {
                throw new IllegalArgumentException("Invalid configuration: unknown commands " + unknown);
            }
            builder.allowedCommands(allowed);
            builder.blockedCategories(categories(strings(filters.getArray("blockedCategories"))));
        }
        return builder.build();
    }

    private static Optional<Boolean> bool(TomlTable table, String key) {
        return Optional.ofNullable(table.getBoolean(key));
    }

    private static List<String> strings(TomlArray array) {
        List<String> values = new ArrayList<>();
        if (array == null) {
            return values;
        }
        for (int i = 0; i < array.size(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }

    private static Set<CommandCategory> categories(List<String> names) {
        Set<CommandCategory> categories = EnumSet.noneOf(CommandCategory.class);
        for (String name : names) {
            categories.add(CommandCategory.fromName(name)
                .orElseThrow(() -> new IllegalArgumentException("Invalid configuration: unknown category " + name)));
        }
        return categories;
    }
}
