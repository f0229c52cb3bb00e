package org.endlesssource.mediafeed.examples;

import org.endlesssource.mediafeed.MediaEngineFactory;
import org.endlesssource.mediafeed.api.MediaFeedOptions;
import org.endlesssource.mediafeed.pipeline.AcquisitionPipeline;
import org.endlesssource.mediafeed.pipeline.ReadyMedia;
import org.endlesssource.mediafeed.pipeline.RootSet;
import org.endlesssource.mediafeed.pool.EngineWorkerPool;
import org.endlesssource.mediafeed.spi.ProviderStatus;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Scanner;
import java.util.concurrent.TimeUnit;

public final class MediaFeedCliExample {

    public static void main(String[] args) {
        ProviderStatus status = MediaEngineFactory.getCurrentStatus();
        if (!status.available()) {
            System.out.println("No media engine available: " + status.providerId());
            System.out.println("Reason: " + status.reason());
            return;
        }

        RootSet roots = new RootSet();
        for (String arg : args) {
            roots.add(Path.of(arg));
        }
        MediaFeedOptions options = MediaFeedOptions.defaults();
        EngineWorkerPool pool = new EngineWorkerPool(MediaEngineFactory.createProvider(), options.getWorkerCount());

        try (AcquisitionPipeline pipeline = new AcquisitionPipeline(options, roots, pool);
             Scanner scanner = new Scanner(System.in)) {
            pipeline.start();
            System.out.println("Media Feed CLI");
            printHelp();

            ReadyMedia current = null;
            while (true) {
                System.out.print("feed> ");
                if (!scanner.hasNextLine()) {
                    break;
                }

                String line = scanner.nextLine().trim();
                if (line.isEmpty()) {
                    continue;
                }

                String[] parts = line.split("\\s+", 2);
                String cmd = parts[0].toLowerCase();
                String arg = parts.length > 1 ? parts[1].trim() : "";

                switch (cmd) {
                    case "help" -> printHelp();
                    case "quit", "exit" -> {
                        closeQuietly(current);
                        return;
                    }
                    case "next" -> {
                        closeQuietly(current);
                        current = playNext(pipeline);
                    }
                    case "stop" -> {
                        closeQuietly(current);
                        current = null;
                    }
                    case "status" -> System.out.println(pipeline.status());
                    case "queue" -> printQueue(pipeline.readyQueue().paths());
                    case "roots" -> printRoots(pipeline.roots());
                    case "add" -> runRootCommand(arg, "add", path -> pipeline.addRoot(path));
                    case "remove" -> runRootCommand(arg, "remove", path -> pipeline.removeRoot(path));
                    case "enable" -> runRootCommand(arg, "enable", path -> pipeline.setRootEnabled(path, true));
                    case "disable" -> runRootCommand(arg, "disable", path -> pipeline.setRootEnabled(path, false));
                    case "reset" -> System.out.println("Dropped " + pipeline.resetQueue() + " ready items");
                    default -> System.out.println("Unknown command: " + cmd + " (type 'help')");
                }
            }
            closeQuietly(current);
        } catch (Exception e) {
            System.err.println("Media feed CLI failed: " + e.getMessage());
        }
    }

    private static void printHelp() {
        System.out.println("Commands:");
        System.out.println("  help                Show this help");
        System.out.println("  next                Play the next ready item");
        System.out.println("  stop                Stop the current item");
        System.out.println("  status              Show queue counters");
        System.out.println("  queue               List ready items");
        System.out.println("  roots               List roots");
        System.out.println("  add|remove <dir>    Add or forget a root");
        System.out.println("  enable|disable <dir>  Toggle a root");
        System.out.println("  reset               Drop every ready item");
        System.out.println("  exit                Quit");
    }

    private static ReadyMedia playNext(AcquisitionPipeline pipeline) throws Exception {
        Optional<ReadyMedia> next = pipeline.nextReady(Duration.ofSeconds(5));
        if (next.isEmpty()) {
            System.out.println("Nothing ready.");
            return null;
        }
        ReadyMedia media = next.get();
        media.play().get(5, TimeUnit.SECONDS);
        System.out.printf("Playing %s %s%n", media.kind(), media.path());
        return media;
    }

    private static void printQueue(List<Path> paths) {
        if (paths.isEmpty()) {
            System.out.println("Ready queue is empty.");
            return;
        }
        for (int i = 0; i < paths.size(); i++) {
            System.out.printf("  [%d] %s%n", i, paths.get(i));
        }
    }

    private static void printRoots(RootSet roots) {
        roots.enabledRoots().forEach(root -> System.out.println("  + " + root));
        roots.disabledRoots().forEach(root -> System.out.println("  - " + root));
    }

    private static void runRootCommand(String arg, String name, RootCall call) {
        if (arg.isEmpty()) {
            System.out.println("Usage: " + name + " <dir>");
            return;
        }
        boolean changed = call.invoke(Path.of(arg));
        System.out.println(name + ": " + (changed ? "ok" : "no change"));
    }

    private static void closeQuietly(ReadyMedia media) {
        if (media != null) {
            media.close();
        }
    }

    @FunctionalInterface
    private interface RootCall {
        boolean invoke(Path path);
    }

    private MediaFeedCliExample() {
    }
}
