package com.remit.matching;

import com.remit.matching.command.MatchCommand;
import com.remit.matching.command.VerifyCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(
    name = "remit-match",
    mixinStandardHelpOptions = true,
    version = "remit-match 1.0.0",
    description = "Match remittance lines against outstanding invoices",
    subcommands = {
        MatchCommand.class,
        VerifyCommand.class
    }
)
public class RemitMatchCli implements Callable<Integer> {

    @Option(names = {"-v", "--verbose"}, description = "Show normalized keys for every line")
    boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new RemitMatchCli())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public boolean isVerbose() {
        return verbose;
    }
}
