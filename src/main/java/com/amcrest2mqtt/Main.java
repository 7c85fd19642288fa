package com.amcrest2mqtt;

import com.amcrest2mqtt.config.Config;
import com.amcrest2mqtt.config.ConfigLoader;
import com.amcrest2mqtt.config.ConfigurationException;
import java.io.File;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.LogManager;

import static com.google.common.base.Preconditions.checkNotNull;

public class Main {
    final static Logger LOGGER = LoggerFactory.getLogger(Main.class);

    static final String CONFIG_OPTION_NAME = "config";
    static final String HELP_OPTION_NAME = "help";
    static final String AMCREST2MQTT_APP_NAME = "amcrest2mqtt";
    static final int CONFIGURATION_ERROR_EXIT_CODE = 1;

    public static void resetLog4j2Context() {
        LoggerContext context = (LoggerContext)LogManager.getContext(false);
        context.reconfigure();
    }

    static Options options() {
        Options options = new Options();
        options.addOption("c", CONFIG_OPTION_NAME, true,
                "Config file name (file path or classpath resource). Environment variables override it");
        options.addOption("h", HELP_OPTION_NAME, false, "Print this help");
        return options;
    }

    public static void main(String[] args) {
        CommandLineParser parser = new DefaultParser();
        Options options = options();

        try {
            CommandLine line = parser.parse(options, args);
            if (line.hasOption(HELP_OPTION_NAME)) {
                HelpFormatter formatter = new HelpFormatter();
                formatter.printHelp(AMCREST2MQTT_APP_NAME, options);
                return;
            }

            Config config = ConfigLoader.fromSystemEnvironment().load(line.getOptionValue(CONFIG_OPTION_NAME));

            if (!Strings.isBlank(config.log4jFolder())) {
                File logsFolder = new File(checkNotNull(config.log4jFolder()));
                if (!logsFolder.exists()) {
                    logsFolder.mkdirs();
                }
                String fullLogsFolderPaths = logsFolder.getAbsolutePath();
                if (!fullLogsFolderPaths.endsWith("/")) {
                    fullLogsFolderPaths = fullLogsFolderPaths + "/";
                }

                System.setProperty("LOG_FOLDER", fullLogsFolderPaths);
                resetLog4j2Context();
            }

            //This will block until shutdown
            BridgeService.run(config);
        } catch (ParseException pe) {
            System.out.println("Argument parsing error: " + pe.getMessage());

            HelpFormatter formatter = new HelpFormatter();
            formatter.printHelp(AMCREST2MQTT_APP_NAME, options);
            System.exit(CONFIGURATION_ERROR_EXIT_CODE);
        } catch (ConfigurationException e) {
            LOGGER.error("Configuration error: {}", e.getMessage());
            System.exit(CONFIGURATION_ERROR_EXIT_CODE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.error("Interrupted", e);
            System.exit(1);
        } catch (Exception e) {
            LOGGER.error("Error: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
