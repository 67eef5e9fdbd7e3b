package com.example.imageguard;

import com.example.imageguard.capability.HsvPixelCleaner;
import com.example.imageguard.capability.ImageIoMetadataStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Basic CLI contract: a single JSON config file path is required.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar image-guard.jar <config.json>");
            System.exit(1);
        }
        Path configPath = Path.of(args[0]);
        GuardConfig config = new ConfigLoader().load(configPath);
        GuardService service = new GuardService(
                config,
                new ImageIoMetadataStripper(),
                new HsvPixelCleaner(),
                PipelineListener.noop()
        );

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                service.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                stopped.countDown();
            }
        }, "guard-shutdown"));

        service.start();
        stopped.await();
    }
}
