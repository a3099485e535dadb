package com.mchart.chart.worker;

import com.mchart.config.ChartProperties;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.jar.JarFile;

/**
 * Builds the command line that starts a crawl worker JVM. The request and result file paths are
 * appended as the last two arguments.
 */
public class WorkerCommandFactory {
    static final String WORKER_LOGBACK_CONFIG = "mchart-worker-logback.xml";
    private static final String BOOT_LAUNCHER = "org.springframework.boot.loader.launch.PropertiesLauncher";

    private final List<String> baseCommand;

    public WorkerCommandFactory(List<String> baseCommand) {
        if (baseCommand == null || baseCommand.isEmpty()) {
            throw new IllegalArgumentException("Worker command must not be empty");
        }
        this.baseCommand = List.copyOf(baseCommand);
    }

    public static WorkerCommandFactory fromProperties(ChartProperties.Isolation isolation) {
        String javaCommand = isolation.getJavaCommand();
        if (javaCommand == null || javaCommand.isBlank()) {
            javaCommand = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        }
        String classpath = isolation.getClasspath();
        if (classpath == null || classpath.isBlank()) {
            classpath = System.getProperty("java.class.path");
        }

        List<String> command = new ArrayList<>();
        command.add(javaCommand);
        command.addAll(isolation.getJvmArgs());
        command.add("-Dlogback.configurationFile=" + WORKER_LOGBACK_CONFIG);
        command.add("-cp");
        command.add(classpath);
        if (isRepackagedBootJar(classpath)) {
            command.add("-Dloader.main=" + ChartCrawlWorkerMain.class.getName());
            command.add(BOOT_LAUNCHER);
        } else {
            command.add(ChartCrawlWorkerMain.class.getName());
        }
        return new WorkerCommandFactory(command);
    }

    public List<String> command(Path requestFile, Path resultFile) {
        List<String> command = new ArrayList<>(baseCommand);
        command.add(requestFile.toString());
        command.add(resultFile.toString());
        return command;
    }

    public List<String> baseCommand() {
        return baseCommand;
    }

    /**
     * A single executable jar keeps application classes under BOOT-INF and needs the Boot launcher.
     */
    static boolean isRepackagedBootJar(String classpath) {
        if (classpath == null || classpath.contains(File.pathSeparator) || !classpath.endsWith(".jar")) {
            return false;
        }
        Path jar = Path.of(classpath);
        if (!Files.isRegularFile(jar)) {
            return false;
        }
        try (JarFile jarFile = new JarFile(jar.toFile())) {
            return jarFile.getEntry("BOOT-INF/classes/") != null;
        } catch (IOException e) {
            return false;
        }
    }
}
