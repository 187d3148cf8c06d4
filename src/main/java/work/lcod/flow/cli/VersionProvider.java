package work.lcod.flow.cli;

import picocli.CommandLine;

/** {@code --version}: the jar's implementation version and the Java runtime it runs on. */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "flow " + (implementationVersion != null ? implementationVersion : "development"),
            "Java " + Runtime.version() + " (" + System.getProperty("java.vendor", "unknown vendor") + ")"
        };
    }
}
