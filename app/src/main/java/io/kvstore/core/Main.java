package io.kvstore.core;

import io.kvstore.core.codec.Codecs;
import io.kvstore.core.config.StoreConfig;
import io.kvstore.core.error.DecodeException;
import io.kvstore.core.error.KvException;
import io.kvstore.core.metrics.StoreMetrics;
import io.kvstore.core.storage.Bucket;
import io.kvstore.core.storage.Item;
import io.kvstore.core.storage.Iter;
import io.kvstore.core.storage.Store;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }
        int status = run(options, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /** Executes the parsed command against the store under {@code options.dataDir()}. */
    static int run(CliOptions options, PrintStream out, PrintStream err) {
        Path dataPath = options.dataDir().toAbsolutePath().normalize();
        StoreConfig config = StoreConfig.defaults(dataPath).withReadOnly(options.readOnly());
        try (Store store = Store.open(config)) {
            return execute(store, options, out, err);
        } catch (KvException e) {
            err.println("Error: " + e.getMessage());
            return 2;
        }
    }

    static int execute(Store store, CliOptions options, PrintStream out, PrintStream err) {
        Bucket<String, String> bucket = store.bucket(options.bucket(), Codecs.string(), Codecs.string());
        List<String> a = options.arguments();
        switch (options.command()) {
            case "get": {
                Optional<String> value = bucket.get(a.get(0));
                if (value.isEmpty()) {
                    err.println("Not found: " + a.get(0));
                    return 1;
                }
                out.println(value.get());
                return 0;
            }
            case "set": {
                Optional<String> previous = bucket.set(a.get(0), a.get(1));
                previous.ifPresent(p -> out.println("previous=" + p));
                return 0;
            }
            case "remove": {
                Optional<String> previous = bucket.remove(a.get(0));
                if (previous.isEmpty()) {
                    err.println("Not found: " + a.get(0));
                    return 1;
                }
                out.println("removed=" + previous.get());
                return 0;
            }
            case "list": {
                try (Iter<String, String> it = bucket.iter()) {
                    while (it.hasNext()) {
                        out.println(describe(it.next()));
                    }
                }
                return 0;
            }
            case "buckets": {
                store.buckets().forEach(out::println);
                return 0;
            }
            case "drop": {
                if (!store.dropBucket(a.get(0))) {
                    err.println("No such bucket: " + a.get(0));
                    return 1;
                }
                LOG.info("Bucket '" + a.get(0) + "' dropped from the command line");
                return 0;
            }
            case "stats": {
                out.println("bucket=" + bucket.name().orElse("<default>") + " entries=" + bucket.len());
                out.println("buckets=" + store.buckets().size());
                out.println(StoreMetrics.scrapeMetrics());
                return 0;
            }
            default:
                throw new IllegalStateException("Unhandled command " + options.command());
        }
    }

    private static String describe(Item<String, String> item) {
        String key;
        String value;
        try {
            key = item.key();
        } catch (DecodeException e) {
            key = "0x" + item.rawKey().toHex();
        }
        try {
            value = item.value();
        } catch (DecodeException e) {
            value = "0x" + item.rawValue().toHex();
        }
        return key + "=" + value;
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            String bucket,
            boolean readOnly,
            String command,
            List<String> arguments
    ) {
        private static final List<String> COMMANDS =
                List.of("get", "set", "remove", "list", "buckets", "drop", "stats");

        static CliOptions parse(String[] args) {
            Path dataDir = envPath("KV_DATA_DIR", Path.of("./data/kv"));
            String bucket = null;
            boolean readOnly = false;
            boolean showHelp = false;
            String error = null;
            List<String> positional = new ArrayList<>();

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.startsWith("--bucket=")) {
                        bucket = arg.substring("--bucket=".length());
                    } else if (arg.equals("--read-only")) {
                        readOnly = true;
                    } else if (!arg.startsWith("--")) {
                        positional.add(arg);
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (bucket != null && bucket.isBlank()) {
                bucket = null;
            }

            String command = null;
            List<String> arguments = List.of();
            if (!positional.isEmpty()) {
                command = positional.get(0);
                arguments = List.copyOf(positional.subList(1, positional.size()));
            }
            if (error == null && !showHelp) {
                error = validate(command, arguments);
                showHelp = error != null;
            }

            return new CliOptions(showHelp, error, dataDir, bucket, readOnly, command, arguments);
        }

        private static String validate(String command, List<String> arguments) {
            if (command == null) {
                return "Missing command";
            }
            if (!COMMANDS.contains(command)) {
                return "Unknown command: " + command;
            }
            int expected = arity(command);
            if (arguments.size() != expected) {
                return "Command '" + command + "' takes " + expected + " argument(s), got " + arguments.size();
            }
            return null;
        }

        private static int arity(String command) {
            switch (command) {
                case "set":
                    return 2;
                case "get":
                case "remove":
                case "drop":
                    return 1;
                default:
                    return 0;
            }
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: kvstore [options] <command> [args]

Commands:
  get <key>                  Print the value stored under <key>
  set <key> <value>          Store <value> under <key>, printing the value it replaced
  remove <key>               Delete <key>, printing the value it held
  list                       Print every key=value pair of the bucket in key order
  buckets                    Print the names of all named buckets
  drop <bucket>              Delete a named bucket and all its entries
  stats                      Print entry counts and transaction/batch metrics

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Directory of the store (default ./data/kv)
  --bucket=<name>            Named bucket to operate on (default bucket if omitted)
  --read-only                Open the store read-only

Environment overrides:
  KV_DATA_DIR                Override --data-dir
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }
    }
}
