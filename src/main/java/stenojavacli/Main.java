package stenojavacli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "stenojava",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "\033[1;34mRight-E steno theory lookup CLI\033[0m",
        subcommands = {
                LookupCommand.class,
                TablesCommand.class
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        // Called when no subcommand is provided
        System.out.println("Use --help or a subcommand (lookup / tables)");
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
