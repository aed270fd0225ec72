package tw.gc.basis.trader.services.telegram;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import tw.gc.basis.trader.config.TelegramProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Outbound Telegram notifications for monitor alerts. Disabled unless configured.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TelegramService {

    private static final String SEND_MESSAGE_URL = "https://api.telegram.org/bot%s/sendMessage";

    @NonNull
    private final RestTemplate restTemplate;
    @NonNull
    private final TelegramProperties telegramProperties;

    public boolean isEnabled() {
        return telegramProperties.isEnabled()
                && telegramProperties.getBotToken() != null && !telegramProperties.getBotToken().isBlank()
                && telegramProperties.getChatId() != null && !telegramProperties.getChatId().isBlank();
    }

    public void sendMessage(String message) {
        if (!isEnabled()) {
            log.debug("[Telegram disabled] {}", message);
            return;
        }

        try {
            String url = String.format(SEND_MESSAGE_URL, telegramProperties.getBotToken());

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            Map<String, Object> body = new HashMap<>();
            body.put("chat_id", telegramProperties.getChatId());
            body.put("text", message);

            HttpEntity<Map<String, Object>> request = new HttpEntity<>(body, headers);
            restTemplate.postForObject(url, request, String.class);
            log.debug("Telegram message sent");

        } catch (Exception e) {
            log.error("Failed to send Telegram message", e);
        }
    }
}
