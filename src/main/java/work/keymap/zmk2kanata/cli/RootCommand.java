package work.keymap.zmk2kanata.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "zmk2kanata",
    description = "Convert ZMK keymaps into Kanata configurations.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {ConvertCommand.class}
)
final class RootCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand (try 'convert').");
    }
}
