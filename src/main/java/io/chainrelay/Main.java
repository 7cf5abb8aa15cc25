package io.chainrelay;

import io.chainrelay.cli.ChainRelayCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = ChainRelayCommand.commandLine().execute(args);
        System.exit(code);
    }
}
