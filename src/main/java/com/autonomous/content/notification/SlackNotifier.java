package com.autonomous.content.notification;

import com.autonomous.content.model.NotificationEvent;
import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Posts notifications to a Slack channel. Without a bot token messages are only logged.
 */
@Service
public class SlackNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(SlackNotifier.class);

    @Value("${slack.bot.token:}")
    private String slackBotToken;

    @Value("${slack.notification.channel:#content-pipeline}")
    private String channel;

    private final Slack slack = Slack.getInstance();
    private final ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "slack-notifier");
        thread.setDaemon(true);
        return thread;
    });

    public void setSlackBotToken(String slackBotToken) {
        this.slackBotToken = slackBotToken;
    }

    @Override
    public void notify(String organizationId, NotificationEvent event, Map<String, Object> payload) {
        String message = formatMessage(organizationId, event, payload);
        if (slackBotToken == null || slackBotToken.isBlank()) {
            log.info("Notification (Slack disabled): {}", message);
            return;
        }
        executor.submit(() -> sendMessage(message));
    }

    String formatMessage(String organizationId, NotificationEvent event, Map<String, Object> payload) {
        StringBuilder message = new StringBuilder();
        message.append(switch (event) {
            case BUDGET_ALERT -> ":warning: *Budget alert*";
            case PIPELINE_COMPLETED -> ":white_check_mark: *Pipeline completed*";
            case PIPELINE_FAILED -> ":x: *Pipeline failed*";
        });
        message.append(" for organization `").append(organizationId).append("`");
        if (payload != null) {
            new TreeMap<>(payload).forEach((key, value) ->
                message.append("\n• ").append(key).append(": ").append(value));
        }
        return message.toString();
    }

    private void sendMessage(String text) {
        try {
            MethodsClient methods = slack.methods(slackBotToken);

            ChatPostMessageRequest request = ChatPostMessageRequest.builder()
                .channel(channel)
                .text(text)
                .build();

            ChatPostMessageResponse response = methods.chatPostMessage(request);

            if (!response.isOk()) {
                log.warn("Failed to send Slack notification: {}", response.getError());
            }
        } catch (Exception e) {
            log.warn("Failed to send Slack notification to {}", channel, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
    }
}
