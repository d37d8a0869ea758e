package com.talentscout.app;

import com.talentscout.config.Config;
import com.talentscout.model.PipelineResult;
import com.talentscout.model.SearchCriteria;
import com.talentscout.orchestrator.InvalidCriteriaException;
import com.talentscout.orchestrator.ProgressListener;
import com.talentscout.output.PipelineResultJson;
import com.talentscout.pipeline.CandidatePipeline;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class TalentScoutApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;
    // The real stdout once routing replaces System.out.
    private static volatile PrintStream PAYLOAD_OUT = System.out;

    public static void main(String[] args) {
        int exit = new TalentScoutApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("talentscout", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("talentscout", options);
            return 0;
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);
            Logger log = LogManager.getLogger(TalentScoutApplication.class);

            SearchCriteria criteria;
            try {
                criteria = CriteriaLoader.fromCommandLine(cmd, workingDir);
            } catch (InvalidCriteriaException e) {
                System.err.println("ERROR: " + e.getMessage());
                return 2;
            }

            CandidatePipeline pipeline = CandidatePipeline.create(config, ProgressListener.logging(), !cmd.hasOption("no-sink"));
            PipelineResult result;
            try {
                result = pipeline.run(criteria);
            } catch (InvalidCriteriaException e) {
                System.err.println("ERROR: " + e.getMessage());
                return 2;
            }

            String json = new PipelineResultJson().toPrettyJson(result);
            if (cmd.hasOption("output")) {
                Path out = workingDir.resolve(cmd.getOptionValue("output")).normalize();
                if (out.getParent() != null) {
                    Files.createDirectories(out.getParent());
                }
                Files.writeString(out, json + System.lineSeparator(), StandardCharsets.UTF_8);
                log.info("payload written file={} candidates={}", out, result.candidates.size());
            } else {
                PrintStream out = payloadStream();
                out.println(json);
                out.flush();
            }
            return 0;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    static void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (TalentScoutApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("talentscout.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j first so the console appender keeps the original streams.
                LogManager.getLogger(TalentScoutApplication.class);
                PAYLOAD_OUT = System.out;
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    static PrintStream payloadStream() {
        return LOG_ROUTE_INSTALLED ? PAYLOAD_OUT : System.out;
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("criteria").hasArg().argName("file").desc("criteria JSON file (query, location, skills, keywords, roleTypes, sources, timeBudget, limit)").build());
        options.addOption(Option.builder().longOpt("query").hasArg().argName("text").desc("free-text search query").build());
        options.addOption(Option.builder().longOpt("location").hasArg().argName("text").desc("preferred candidate location").build());
        options.addOption(Option.builder().longOpt("skills").hasArg().argName("list").desc("comma separated skills").build());
        options.addOption(Option.builder().longOpt("keywords").hasArg().argName("list").desc("comma separated keywords").build());
        options.addOption(Option.builder().longOpt("roles").hasArg().argName("list").desc("comma separated role types").build());
        options.addOption(Option.builder().longOpt("sources").hasArg().argName("list").desc("comma separated sources: github, stackoverflow, linkedin, google, devto").build());
        options.addOption(Option.builder().longOpt("time-budget").hasArg().argName("seconds").desc("overall collection budget in seconds").build());
        options.addOption(Option.builder().longOpt("limit").hasArg().argName("n").desc("maximum candidates returned").build());
        options.addOption(Option.builder().longOpt("output").hasArg().argName("file").desc("write the JSON payload to a file instead of stdout").build());
        options.addOption(Option.builder().longOpt("no-sink").desc("do not persist candidates under outputs/profiles").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
