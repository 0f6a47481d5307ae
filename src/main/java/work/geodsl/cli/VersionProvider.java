package work.geodsl.cli;

import picocli.CommandLine;
import work.geodsl.command.CommandCategory;
import work.geodsl.command.CommandTable;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String version = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "geodsl (java) " + (version == null ? "development" : version),
            "catalogue: " + CommandTable.standard().size() + " commands in "
                + CommandCategory.values().length + " categories",
        };
    }
}
