package com.elara.kconfig.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.elara.debug.Debug;
import com.elara.kconfig.Kconfig;
import com.elara.kconfig.KconfigEnvironment;
import com.elara.kconfig.KconfigSyntaxError;
import com.elara.kconfig.json.KconfigJsonExporter;

/**
 * Command-line front-end.
 *
 *   KconfigCli <command> <Kconfig file> [args]
 *
 * The .config file is taken from KCONFIG_CONFIG, defaulting to ".config".
 * Diagnostics go to standard error.
 *
 * Exit codes: 0 success, 1 bad Kconfig input or missing .config,
 * 2 usage error, 3 I/O error.
 */
public final class KconfigCli {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    private static final String USAGE =
            "Usage: KconfigCli <command> <Kconfig file> [args]\n"
            + "Commands:\n"
            + "  olddefconfig        update an existing configuration with defaults for new symbols\n"
            + "  alldefconfig        write a configuration with every symbol at its default\n"
            + "  allnoconfig         write a configuration with as many symbols as possible disabled\n"
            + "  allyesconfig        write a configuration with as many symbols as possible enabled\n"
            + "  listnewconfig       list symbols missing from the existing configuration\n"
            + "  eval <expr>         evaluate an expression against the existing configuration\n"
            + "  dump                print the configuration as JSON";

    public static void main(String[] args) {
        Debug.useSysErr();
        System.exit(run(args, KconfigEnvironment.fromSystem(), System.out, System.err));
    }

    public static int run(String[] args, KconfigEnvironment env, PrintStream out, PrintStream err) {
        if (args.length < 2) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        String command = args[0];
        Path kconfigFile = Path.of(args[1]);
        String configFile = env.get("KCONFIG_CONFIG") == null ? ".config" : env.get("KCONFIG_CONFIG");

        if (command.equals("eval") ? args.length != 3 : args.length != 2) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            Kconfig kconfig;
            switch (command) {
                case "olddefconfig":
                    if (!Files.exists(Path.of(configFile))) {
                        err.println("KconfigCli: '" + configFile + "' not found");
                        return EXIT_ERROR;
                    }
                    kconfig = Kconfig.load(kconfigFile, env);
                    ConfigPresets.oldDef(kconfig, configFile);
                    kconfig.writeConfig(Path.of(configFile));
                    out.println("Updated configuration written to '" + configFile + "'");
                    return EXIT_OK;

                case "alldefconfig":
                    kconfig = Kconfig.load(kconfigFile, env);
                    ConfigPresets.allDef(kconfig);
                    kconfig.writeConfig(Path.of(configFile));
                    return EXIT_OK;

                case "allnoconfig":
                    kconfig = Kconfig.load(kconfigFile, env, false, null);
                    ConfigPresets.allNo(kconfig);
                    kconfig.writeConfig(Path.of(configFile));
                    return EXIT_OK;

                case "allyesconfig":
                    kconfig = Kconfig.load(kconfigFile, env, false, null);
                    ConfigPresets.allYes(kconfig);
                    kconfig.writeConfig(Path.of(configFile));
                    return EXIT_OK;

                case "listnewconfig":
                    kconfig = loadWithExistingConfig(kconfigFile, env, configFile);
                    for (String line : ConfigPresets.listNew(kconfig)) out.println(line);
                    return EXIT_OK;

                case "eval":
                    kconfig = loadWithExistingConfig(kconfigFile, env, configFile);
                    out.println(kconfig.evalString(args[2]).text());
                    return EXIT_OK;

                case "dump":
                    kconfig = loadWithExistingConfig(kconfigFile, env, configFile);
                    out.println(new KconfigJsonExporter().exportString(kconfig));
                    return EXIT_OK;

                default:
                    err.println("Unknown command: " + command);
                    err.println(USAGE);
                    return EXIT_USAGE;
            }
        } catch (KconfigSyntaxError e) {
            err.println(e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return EXIT_IO;
        }
    }

    private static Kconfig loadWithExistingConfig(Path kconfigFile, KconfigEnvironment env, String configFile)
            throws IOException {
        Kconfig kconfig = Kconfig.load(kconfigFile, env);
        if (Files.exists(Path.of(configFile))) {
            kconfig.loadConfig(configFile, true);
            Debug.get().d("kconfig", "loaded " + configFile);
        }
        return kconfig;
    }

    private KconfigCli() {}
}
