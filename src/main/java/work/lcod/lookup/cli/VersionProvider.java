package work.lcod.lookup.cli;

import picocli.CommandLine;

/**
 * Reports the jar's {@code Implementation-Version} and the running JVM.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String UNRELEASED = "0.0.0-dev";

    @Override
    public String[] getVersion() {
        return new String[] {
            "lcod-lookup " + projectVersion(),
            "JVM: " + System.getProperty("java.vm.name") + " " + Runtime.version()
        };
    }

    static String projectVersion() {
        Package pkg = LookupCommand.class.getPackage();
        String version = pkg == null ? null : pkg.getImplementationVersion();
        return version == null || version.isBlank() ? UNRELEASED : version;
    }
}
