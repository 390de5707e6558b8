package com.umitunal.hybridq.cli;

import com.umitunal.hybridq.client.QueueClient;
import com.umitunal.hybridq.config.ClientConfig;
import com.umitunal.hybridq.config.ConfigFile;
import com.umitunal.hybridq.config.DaemonConfig;
import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;
import com.umitunal.hybridq.core.JobView;
import com.umitunal.hybridq.core.QueueMetrics;
import com.umitunal.hybridq.core.QueueState;
import com.umitunal.hybridq.daemon.HybridQueueDaemon;
import com.umitunal.hybridq.protocol.FrameCodec;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "hybridq", mixinStandardHelpOptions = true, version = "hybridq 1.0.0",
        description = "Submit and run jobs on a single exclusive compute resource",
        subcommands = {
                HybridQueueCli.Daemon.class,
                HybridQueueCli.Submit.class,
                HybridQueueCli.QueueStatus.class,
                HybridQueueCli.Remove.class,
                HybridQueueCli.Kill.class,
                HybridQueueCli.QueueStateCommand.class,
                HybridQueueCli.StopQueue.class,
                HybridQueueCli.StartQueue.class
        })
public class HybridQueueCli implements Runnable {
    static final String LOGGER_NAME = "com.umitunal.hybridq";

    @Option(names = "--host", description = "Daemon host (default: localhost)")
    String host;

    @Option(names = {"-p", "--port"}, description = "Daemon port (default: 1337)")
    Integer port;

    @Option(names = "--ca", description = "CA certificate (PEM) used to verify the peer; repeatable")
    List<Path> caCertificates = new ArrayList<>();

    @Option(names = "--insecure", description = "Use plain TCP without TLS")
    boolean insecure;

    @Option(names = "--no-system-ca", description = "Do not trust the JVM's default CA certificates")
    boolean noSystemTrustStore;

    @Option(names = "--config", description = "JSON configuration file")
    Path configPath;

    @Option(names = "--loglevel", description = "Log level: ERROR, WARN, INFO, DEBUG, TRACE")
    String logLevel;

    @Option(names = "--dump-json", description = "Log every protocol message")
    boolean dumpProtocol;

    @Option(names = "--max-frame-bytes",
            description = "Largest protocol document accepted from the peer (daemon default: 16 MiB, client default: unlimited)")
    Integer maxFrameBytes;

    private ConfigFile configFile;

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /**
     * Build the command line with the error-to-exit-code mapping installed.
     */
    public static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new HybridQueueCli());
        commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
            PrintWriter err = cmd.getErr();
            if (e instanceof HybridQueueException) {
                HybridQueueException failure = (HybridQueueException) e;
                err.println("Error: " + failure);
                err.flush();
                return exitCodeFor(failure.getKind());
            }
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        });
        return commandLine;
    }

    static int exitCodeFor(ErrorKind kind) {
        return kind == ErrorKind.CONFIG_CONFLICT ? 2 : 1;
    }

    /**
     * Load the configuration file once and apply the log level. Command line values win.
     */
    ConfigFile settings() throws HybridQueueException {
        if (configFile == null) {
            configFile = configPath == null ? ConfigFile.empty() : ConfigFile.load(configPath);
            String level = logLevel != null ? logLevel : configFile.getString("loglevel").orElse(null);
            if (level != null) {
                Configurator.setLevel(LOGGER_NAME, Level.toLevel(level, Level.INFO));
            }
        }
        return configFile;
    }

    List<Path> caCertificates(ConfigFile file) {
        return caCertificates.isEmpty() ? file.getPaths("ca") : caCertificates;
    }

    boolean insecure(ConfigFile file) throws HybridQueueException {
        return insecure || file.getBoolean("insecure");
    }

    boolean dumpProtocol(ConfigFile file) throws HybridQueueException {
        return dumpProtocol || file.getBoolean("dump_protocol");
    }

    int port(ConfigFile file) throws HybridQueueException {
        return port != null ? port : file.getInt("port").orElse(DaemonConfig.DEFAULT_PORT);
    }

    int maxFrameBytes(ConfigFile file, int defaultBytes) throws HybridQueueException {
        return maxFrameBytes != null ? maxFrameBytes : file.getInt("max_frame_bytes").orElse(defaultBytes);
    }

    /**
     * Base for the commands that talk to a running daemon.
     */
    abstract static class ClientCommand implements Callable<Integer> {
        @ParentCommand
        HybridQueueCli parent;

        @Option(names = "--client-cert", description = "PKCS#12 bundle presented to the daemon")
        Path clientCertificate;

        @Option(names = "--client-cert-password", description = "Password of the client bundle")
        String clientCertificatePassword;

        @Option(names = "--no-verify-hostname", description = "Skip matching the daemon certificate against the host name")
        boolean noVerifyHostname;

        ClientConfig clientConfig() throws HybridQueueException {
            ConfigFile file = parent.settings();
            ClientConfig.Builder builder = ClientConfig.newBuilder()
                    .withHost(parent.host != null ? parent.host
                            : file.getString("host").orElse(ClientConfig.DEFAULT_HOST))
                    .withPort(parent.port(file))
                    .withInsecure(parent.insecure(file))
                    .withCaCertificates(parent.caCertificates(file))
                    .withSystemTrustStore(!parent.noSystemTrustStore)
                    .withHostnameVerification(!noVerifyHostname)
                    .withMaxFrameBytes(parent.maxFrameBytes(file, FrameCodec.MAX_FRAME_BYTES))
                    .withDumpProtocol(parent.dumpProtocol(file));

            Path bundle = clientCertificate != null ? clientCertificate : file.getPath("client_cert").orElse(null);
            if (bundle != null) {
                String password = clientCertificatePassword != null ? clientCertificatePassword
                        : file.getString("cert_password").orElse("");
                builder.withClientCertificate(bundle, password);
            }
            return builder.build();
        }

        @Override
        public Integer call() throws Exception {
            try (QueueClient client = QueueClient.create(clientConfig())) {
                return execute(client);
            }
        }

        abstract int execute(QueueClient client) throws HybridQueueException;
    }

    @Command(name = "daemon", description = "Run the queue daemon in the foreground")
    static class Daemon implements Callable<Integer> {
        @ParentCommand
        HybridQueueCli parent;

        @Option(names = "--cert", description = "PKCS#12 bundle with the server key and certificate chain")
        Path certificate;

        @Option(names = "--cert-password", description = "Password of the server bundle")
        String certificatePassword;

        @Option(names = "--pidfile", description = "PID file guarding against a second daemon")
        Path pidFile;

        @Option(names = "--allow-notify", description = "Accept jobs that carry a notify command")
        boolean allowNotify;

        @Option(names = "--retain-finished", description = "Keep at most this many finished jobs, 0 keeps all")
        Integer retainFinished;

        DaemonConfig daemonConfig() throws HybridQueueException {
            ConfigFile file = parent.settings();
            DaemonConfig.Builder builder = DaemonConfig.newBuilder()
                    .withPort(parent.port(file))
                    .withInsecure(parent.insecure(file))
                    .withCaCertificates(parent.caCertificates(file))
                    .withSystemTrustStore(!parent.noSystemTrustStore)
                    .withNotifyCommands(allowNotify || file.getBoolean("allow_notify"))
                    .withRetainFinished(retainFinished != null ? retainFinished
                            : file.getInt("retain_finished").orElse(0))
                    .withMaxFrameBytes(parent.maxFrameBytes(file, FrameCodec.DEFAULT_MAX_FRAME_BYTES))
                    .withDumpProtocol(parent.dumpProtocol(file));

            Path bundle = certificate != null ? certificate : file.getPath("cert").orElse(null);
            if (bundle != null) {
                String password = certificatePassword != null ? certificatePassword
                        : file.getString("cert_password").orElse("");
                builder.withServerCertificate(bundle, password);
            }
            Path pid = pidFile != null ? pidFile : file.getPath("pidfile").orElse(null);
            if (pid != null) {
                builder.withPidFile(pid);
            }
            Map<String, Path> appKeys = file.getPathMap("appkeys");
            if (!appKeys.isEmpty()) {
                builder.withAppKeys(appKeys);
            }
            return builder.build();
        }

        @Override
        public Integer call() throws Exception {
            HybridQueueDaemon daemon = HybridQueueDaemon.create(daemonConfig());
            Runtime.getRuntime().addShutdownHook(new Thread(daemon::close, "shutdown"));
            daemon.start();
            daemon.awaitTermination();
            return 0;
        }
    }

    @Command(name = "submit", description = "Submit a job")
    static class Submit extends ClientCommand {
        @Parameters(arity = "1..*", paramLabel = "CMDLINE", description = "Command and arguments")
        List<String> cmdline;

        @Option(names = {"-d", "--duration"}, description = "Expected runtime in seconds")
        Long duration;

        @Option(names = {"-n", "--notify"}, description = "Command run by the daemon when the job finishes")
        String notifyCmd;

        @Override
        int execute(QueueClient client) throws HybridQueueException {
            long id = client.submit(String.join(" ", cmdline), duration, notifyCmd);
            System.out.println("Submitted job " + id);
            return 0;
        }
    }

    @Command(name = "queue-status", description = "List queued, running and finished jobs")
    static class QueueStatus extends ClientCommand {
        @Option(names = "--output", description = "Also print captured stdout and stderr")
        boolean showOutput;

        @Override
        int execute(QueueClient client) throws HybridQueueException {
            List<JobView> jobs = client.queueStatus();
            System.out.println(JobTable.render(jobs, showOutput));
            System.out.println(QueueMetrics.of(jobs));
            return 0;
        }
    }

    @Command(name = "remove", description = "Remove a finished job from the status list")
    static class Remove extends ClientCommand {
        @Option(names = "--job-id", required = true, description = "Id of the finished job")
        long jobId;

        @Override
        int execute(QueueClient client) throws HybridQueueException {
            JobView removed = client.remove(jobId);
            System.out.println("Removed job " + removed.getId() + " (" + removed.getStatus() + ")");
            return 0;
        }
    }

    @Command(name = "kill", description = "Terminate the running job")
    static class Kill extends ClientCommand {
        @Option(names = "--job-id", required = true, description = "Id of the running job")
        long jobId;

        @Override
        int execute(QueueClient client) throws HybridQueueException {
            client.kill(jobId);
            System.out.println("Sent termination request to job " + jobId);
            return 0;
        }
    }

    @Command(name = "queue-state", description = "Show whether the queue is starting jobs")
    static class QueueStateCommand extends ClientCommand {
        @Override
        int execute(QueueClient client) throws HybridQueueException {
            System.out.println("Queue is " + client.queueState());
            return 0;
        }
    }

    @Command(name = "stop-queue", description = "Stop starting jobs; a running job finishes")
    static class StopQueue extends ClientCommand {
        @Override
        int execute(QueueClient client) throws HybridQueueException {
            System.out.println("Queue is " + client.setQueueState(QueueState.STOPPED));
            return 0;
        }
    }

    @Command(name = "start-queue", description = "Resume starting queued jobs")
    static class StartQueue extends ClientCommand {
        @Override
        int execute(QueueClient client) throws HybridQueueException {
            System.out.println("Queue is " + client.setQueueState(QueueState.RUNNING));
            return 0;
        }
    }
}
