package clitree;

import java.util.Arrays;

public class EntryPoint {

    public static void main(final String[] args) {
        if (args.length > 0) {
            final var command = args[0];
            final var rest = Arrays.copyOfRange(args, 1, args.length);

            switch (command) {
                case Const.ECHO:
                    clitree.echo.EntryPoint.entryPoint(rest);
                    break;
                case Const.DEMO:
                    clitree.demo.EntryPoint.entryPoint(rest);
                    break;
                default:
                    throw new IllegalArgumentException("Not a valid command.");
            }
        }
    }
}
