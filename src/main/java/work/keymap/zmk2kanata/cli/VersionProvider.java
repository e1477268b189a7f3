package work.keymap.zmk2kanata.cli;

import picocli.CommandLine;

final class VersionProvider implements CommandLine.IVersionProvider {
    static final String DEVELOPMENT = "development";

    @Override
    public String[] getVersion() {
        return new String[] {
            "zmk2kanata " + version(),
            "Java " + Runtime.version()
        };
    }

    static String version() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return implementationVersion != null ? implementationVersion : DEVELOPMENT;
    }
}
