package com.posh.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.posh.debug.Debug;
import com.posh.debug.DebugLevel;
import com.posh.debug.DebugSink;
import com.posh.script.json.ValueJson;
import com.posh.script.parser.ParseException;
import com.posh.script.parser.ScriptRuntimeException;
import com.posh.script.parser.Value;
import com.posh.script.plugins.FileSystemPlugin;
import com.posh.script.plugins.JsonPlugin;
import com.posh.script.plugins.ProcessPlugin;

/**
 * Command-line front-end.
 *
 * Usage: PoshCli [--json] [--debug[=LEVEL]] [--max-depth N] [-c COMMAND | SCRIPT]
 *
 * With neither a command nor a script it starts an interactive prompt.
 * Exit codes: 0 ok, 1 script error, 2 usage, 3 unreadable script file.
 */
public final class PoshCli {

    private static final String USAGE =
            "Usage: PoshCli [--json] [--debug[=LEVEL]] [--max-depth N] [-c COMMAND | SCRIPT]";

    private boolean json;
    private DebugLevel debugLevel;
    private Integer maxDepth;
    private String command;
    private Path script;

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    public static int run(String[] args, java.io.InputStream in, PrintStream out, PrintStream err) {
        PoshCli cli = new PoshCli();
        String usageError = cli.parseArgs(args);
        if (usageError != null) {
            err.println(usageError);
            err.println(USAGE);
            return 2;
        }

        if (cli.debugLevel != null) {
            Debug.get().setThreshold(cli.debugLevel);
            Debug.get().setSink(DebugSink.printing(err));
        }

        PoshScript engine = new PoshScript();
        FileSystemPlugin.register(engine);
        ProcessPlugin.register(engine);
        JsonPlugin.register(engine);
        if (cli.maxDepth != null) engine.setMaxCallDepth(cli.maxDepth);

        PoshSession session = engine.newSession();

        if (cli.command != null) return cli.runSource(session, cli.command, out, err);

        if (cli.script != null) {
            String source;
            try {
                source = Files.readString(cli.script, StandardCharsets.UTF_8);
            } catch (IOException e) {
                err.println("Failed to read script file: " + cli.script + " (" + e.getMessage() + ")");
                return 3;
            }
            return cli.runSource(session, source, out, err);
        }

        return cli.repl(session, new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)), out, err);
    }

    // Returns an error message, or null when the arguments are valid.
    private String parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.equals("--json")) {
                json = true;
            } else if (a.equals("--debug")) {
                debugLevel = DebugLevel.DEBUG;
            } else if (a.startsWith("--debug=")) {
                debugLevel = DebugLevel.parse(a.substring("--debug=".length()));
            } else if (a.equals("--max-depth")) {
                if (++i >= args.length) return "--max-depth needs a value";
                try {
                    maxDepth = Integer.parseInt(args[i]);
                } catch (NumberFormatException e) {
                    return "--max-depth expects an integer, got " + args[i];
                }
                if (maxDepth < 1) return "--max-depth must be at least 1";
            } else if (a.equals("-c")) {
                if (++i >= args.length) return "-c needs a command";
                command = args[i];
            } else if (a.startsWith("-") && !a.equals("-")) {
                return "Unknown option: " + a;
            } else if (script == null) {
                script = Path.of(a);
            } else {
                return "Only one script may be given";
            }
        }
        if (command != null && script != null) return "Give either -c or a script, not both";
        return null;
    }

    private int runSource(PoshSession session, String source, PrintStream out, PrintStream err) {
        try {
            print(session.evaluateLine(source), out);
            return 0;
        } catch (ParseException | ScriptRuntimeException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private int repl(PoshSession session, BufferedReader in, PrintStream out, PrintStream err) {
        StringBuilder pending = new StringBuilder();
        try {
            while (true) {
                out.print(pending.length() == 0 ? "PS> " : ">> ");
                out.flush();
                String line = in.readLine();
                if (line == null) break;
                if (pending.length() == 0 && (line.trim().equalsIgnoreCase("exit") || line.trim().equalsIgnoreCase("quit"))) {
                    break;
                }
                pending.append(line).append('\n');
                if (!isComplete(pending.toString())) continue;

                String source = pending.toString();
                pending.setLength(0);
                try {
                    print(session.evaluateLine(source), out);
                } catch (ParseException | ScriptRuntimeException e) {
                    err.println("Error: " + e.getMessage());
                }
            }
        } catch (IOException e) {
            err.println("Failed to read input: " + e.getMessage());
            return 1;
        }
        return 0;
    }

    /** False while braces or parens are open or a string is unterminated. */
    public static boolean isComplete(String text) {
        int braces = 0;
        int parens = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    if (i + 1 < text.length() && text.charAt(i + 1) == quote) i++;
                    else quote = 0;
                }
                continue;
            }
            switch (c) {
                case '\'': case '"': quote = c; break;
                case '#':
                    while (i < text.length() && text.charAt(i) != '\n') i++;
                    break;
                case '{': braces++; break;
                case '}': braces--; break;
                case '(': parens++; break;
                case ')': parens--; break;
                default: break;
            }
        }
        return braces <= 0 && parens <= 0 && quote == 0;
    }

    private void print(List<Value> values, PrintStream out) {
        for (Value v : values) {
            if (json) {
                try {
                    out.println(ValueJson.write(ValueJson.toJson(v), false));
                } catch (JsonProcessingException e) {
                    throw ScriptRuntimeException.invalidOperation("cannot render output as JSON", e);
                }
            } else {
                out.println(format(v));
            }
        }
    }

    /** Records print one "Key : Value" line per property; everything else its display form. */
    public static String format(Value v) {
        if (v.type != Value.Type.RECORD) return v.toDisplayString();
        Map<String, Value> props = v.asRecord();
        int width = 1;
        for (String k : props.keySet()) width = Math.max(width, k.length());
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Value> e : props.entrySet()) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(String.format("%-" + width + "s : %s", e.getKey(), e.getValue().toDisplayString()));
        }
        return sb.toString();
    }

    private PoshCli() {}
}
