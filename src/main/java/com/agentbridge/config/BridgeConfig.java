package com.agentbridge.config;

import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

@Configuration
public class BridgeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs the buffer-fallback timer chains, one chain per active instance turn.
     */
    @Bean
    public ThreadPoolTaskScheduler fallbackTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("buffer-fallback-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService inboundMessageExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public MethodsClient slackMethodsClient(@Value("${slack.bot.token:}") String slackBotToken) {
        return Slack.getInstance().methods(slackBotToken);
    }

    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(60, TimeUnit.SECONDS)
            .followRedirects(true)
            .retryOnConnectionFailure(true)
            .build();
    }
}
