package com.codelogickeep.agent.llm;

import com.codelogickeep.agent.llm.config.AppConfig;
import com.codelogickeep.agent.llm.config.ConfigLoader;
import com.codelogickeep.agent.llm.config.ConfigValidator;
import com.codelogickeep.agent.llm.exception.ConfigException;
import com.codelogickeep.agent.llm.framework.adapter.LlmProvider;
import com.codelogickeep.agent.llm.framework.adapter.LlmProviderFactory;
import com.codelogickeep.agent.llm.framework.executor.ExecutionResult;
import com.codelogickeep.agent.llm.framework.executor.StepRecorder;
import com.codelogickeep.agent.llm.framework.executor.StepResult;
import com.codelogickeep.agent.llm.framework.model.Message;
import com.codelogickeep.agent.llm.framework.util.JsonUtil;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(name = "llm-bridge", mixinStandardHelpOptions = true, version = "0.1.0",
        description = "Send one conversation to an Anthropic or OpenAI style backend and print the result as JSON.")
public class App implements Callable<Integer> {

    static final String STEP_TYPE = "llm_call";

    static final int EXIT_OK = 0;
    static final int EXIT_STEP_FAILED = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    private final ConfigLoader configLoader;
    private final Function<AppConfig.LlmConfig, LlmProvider> providerFactory;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-c", "--config"}, description = "Path to configuration file (merged over agent.yml)")
    private String configPath;

    @Option(names = {"--protocol"}, description = "Override LLM protocol for this run (anthropic, openai).")
    private String protocol;

    @Option(names = {"--api-key"}, description = "Override LLM API key for this run.")
    private String apiKey;

    @Option(names = {"--model"}, description = "Override model name for this run.")
    private String modelName;

    @Option(names = {"--base-url"}, description = "Override base URL for this run.")
    private String baseUrl;

    @Option(names = {"--temperature"}, description = "Override sampling temperature (0.0 to 2.0).")
    private Double temperature;

    @Option(names = {"--max-tokens"}, description = "Override maximum output tokens.")
    private Integer maxTokens;

    @Option(names = {"--timeout"}, description = "Override request timeout in seconds.")
    private Long timeout;

    @Option(names = {"-s", "--system"}, description = "System instruction (repeatable, sent in the given order).")
    private List<String> systemMessages = new ArrayList<>();

    @Option(names = {"--check-env"}, description = "Print the effective configuration, test the connection and exit.")
    private boolean checkEnv;

    @Parameters(arity = "0..*", paramLabel = "PROMPT", description = "User prompt (required unless --check-env).")
    private List<String> prompt = new ArrayList<>();

    public App() {
        this(new ConfigLoader(), LlmProviderFactory::create);
    }

    App(ConfigLoader configLoader, Function<AppConfig.LlmConfig, LlmProvider> providerFactory) {
        this.configLoader = configLoader;
        this.providerFactory = providerFactory;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new App()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (!checkEnv && prompt.isEmpty()) {
            throw new ParameterException(spec.commandLine(), "Missing required parameter: 'PROMPT'");
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        AppConfig config;
        LlmProvider provider;
        try {
            config = configLoader.load(configPath);
            applyOverrides(config);
            ConfigValidator.validateAndApplyDefaults(config);
            provider = providerFactory.apply(config.getLlm());
        } catch (ConfigException e) {
            err.println("Configuration Error: " + e.getMessage());
            if (e.getContext() != null) {
                err.println("Hint: " + e.getContext());
            }
            err.flush();
            return EXIT_CONFIG_ERROR;
        } catch (IllegalArgumentException e) {
            // 构建器拒绝的组合（如 anthropic + inline）
            err.println("Configuration Error: " + e.getMessage());
            err.flush();
            return EXIT_CONFIG_ERROR;
        }

        if (checkEnv) {
            return checkEnvironment(config, provider, out);
        }

        StepResult step = StepRecorder.record(STEP_TYPE, provider, buildConversation());

        ExecutionResult result = new ExecutionResult(step.success(), step.output(), List.of(step));
        out.println(JsonUtil.toPrettyJson(result));
        out.flush();
        return result.success() ? EXIT_OK : EXIT_STEP_FAILED;
    }

    private int checkEnvironment(AppConfig config, LlmProvider provider, PrintWriter out) {
        out.print(ConfigValidator.getConfigSummary(config));
        boolean connected = LlmProviderFactory.testConnection(provider);
        out.println("connection      = " + (connected ? "OK" : "FAILED") + " (" + provider.getName() + ")");
        out.flush();
        return connected ? EXIT_OK : EXIT_STEP_FAILED;
    }

    void applyOverrides(AppConfig config) {
        if (config.getLlm() == null) {
            config.setLlm(new AppConfig.LlmConfig());
        }
        AppConfig.LlmConfig llm = config.getLlm();
        if (protocol != null) {
            llm.setProtocol(protocol);
        }
        if (apiKey != null) {
            llm.setApiKey(apiKey);
        }
        if (modelName != null) {
            llm.setModel(modelName);
        }
        if (baseUrl != null) {
            llm.setBaseUrl(baseUrl);
        }
        if (temperature != null) {
            llm.setTemperature(temperature);
        }
        if (maxTokens != null) {
            llm.setMaxTokens(maxTokens);
        }
        if (timeout != null) {
            llm.setTimeout(timeout);
        }
    }

    List<Message> buildConversation() {
        List<Message> messages = new ArrayList<>();
        for (String system : systemMessages) {
            messages.add(Message.system(system));
        }
        messages.add(Message.user(String.join(" ", prompt)));
        return messages;
    }
}
