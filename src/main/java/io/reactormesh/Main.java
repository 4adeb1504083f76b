package io.reactormesh;

import io.reactormesh.cli.ReactorMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ReactorMeshCommand()).execute(args);
        System.exit(code);
    }
}
