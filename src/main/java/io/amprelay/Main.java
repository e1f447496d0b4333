package io.amprelay;

import io.amprelay.cli.AmpRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new AmpRelayCommand()).execute(args);
        System.exit(code);
    }
}
