package com.prpulse.pipeline.app;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A parsed command line: the command name, its positional arguments and
 * whether {@code --full} was given. Arity and numeric arguments are checked
 * up front so that a usage error never touches the store.
 */
record Command(String name, List<String> args, boolean full) {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: prpulse <command> [arguments]",
            "  discover",
            "  sync-org <organizationId> [--full]",
            "  sync-repo <repositoryId> [--full]",
            "  summary <organizationId> [windowDays]",
            "  timeseries <organizationId> <days> [repositoryId]",
            "  team <organizationId> [windowDays] [topN] [repositoryId...]",
            "  distribution <organizationId> [windowDays]",
            "  insights <organizationId> [windowDays]",
            "  categories <organizationId>",
            "  seed-categories",
            "  link-installation <organizationId> <installationId>",
            "  track <repositoryId> <true|false>");

    // One bit per position in the numeric mask
    private static final int MAX_POSITIONAL = Integer.SIZE;
    private static final int ALL_NUMERIC = -1;

    // name -> {min positional, max positional, positions that must be numeric as a bit mask}
    private static final Map<String, int[]> ARITY = Map.ofEntries(
            Map.entry("discover", new int[]{0, 0, 0}),
            Map.entry("sync-org", new int[]{1, 1, 0b1}),
            Map.entry("sync-repo", new int[]{1, 1, 0b1}),
            Map.entry("summary", new int[]{1, 2, 0b11}),
            Map.entry("timeseries", new int[]{2, 3, 0b111}),
            Map.entry("team", new int[]{1, MAX_POSITIONAL, ALL_NUMERIC}),
            Map.entry("distribution", new int[]{1, 2, 0b11}),
            Map.entry("insights", new int[]{1, 2, 0b11}),
            Map.entry("categories", new int[]{1, 1, 0b1}),
            Map.entry("seed-categories", new int[]{0, 0, 0}),
            Map.entry("link-installation", new int[]{2, 2, 0b1}),
            Map.entry("track", new int[]{2, 2, 0b1}));

    private static final String FULL_FLAG = "--full";

    Command {
        args = List.copyOf(args);
    }

    /**
     * @throws IllegalArgumentException with a message fit for the user on any usage error
     */
    static Command parse(String[] argv) {
        if (argv == null || argv.length == 0) {
            throw new IllegalArgumentException("No command given");
        }
        String name = argv[0];
        int[] arity = ARITY.get(name);
        if (arity == null) {
            throw new IllegalArgumentException("Unknown command: " + name);
        }

        boolean full = false;
        List<String> positional = new ArrayList<>();
        for (int i = 1; i < argv.length; i++) {
            if (FULL_FLAG.equals(argv[i])) {
                if (!"sync-org".equals(name) && !"sync-repo".equals(name)) {
                    throw new IllegalArgumentException(FULL_FLAG + " only applies to sync-org and sync-repo");
                }
                full = true;
            } else if (argv[i].startsWith("--")) {
                throw new IllegalArgumentException("Unknown option: " + argv[i]);
            } else {
                positional.add(argv[i]);
            }
        }

        if (positional.size() < arity[0] || positional.size() > arity[1]) {
            throw new IllegalArgumentException("Wrong number of arguments for " + name);
        }
        for (int i = 0; i < positional.size(); i++) {
            if ((arity[2] & (1 << i)) != 0) {
                requirePositiveNumber(name, positional.get(i));
            }
        }
        if ("track".equals(name)) {
            String flag = positional.get(1);
            if (!"true".equalsIgnoreCase(flag) && !"false".equalsIgnoreCase(flag)) {
                throw new IllegalArgumentException("track expects true or false, got " + flag);
            }
        }
        return new Command(name, positional, full);
    }

    long longArg(int index) {
        return Long.parseLong(args.get(index));
    }

    int intArg(int index) {
        return Integer.parseInt(args.get(index));
    }

    int intArg(int index, int defaultValue) {
        return index < args.size() ? Integer.parseInt(args.get(index)) : defaultValue;
    }

    /**
     * @return the arguments from {@code index} on, empty when there are none
     */
    List<Long> longArgsFrom(int index) {
        List<Long> values = new ArrayList<>();
        for (int i = index; i < args.size(); i++) {
            values.add(Long.valueOf(args.get(i)));
        }
        return values;
    }

    Long optionalLongArg(int index) {
        return index < args.size() ? Long.valueOf(args.get(index)) : null;
    }

    String arg(int index) {
        return args.get(index);
    }

    private static void requirePositiveNumber(String command, String value) {
        long parsed;
        try {
            parsed = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(command + " expects a number, got '" + value + "'");
        }
        if (parsed < 1 || parsed > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(command + " expects a positive number, got " + value);
        }
    }
}
