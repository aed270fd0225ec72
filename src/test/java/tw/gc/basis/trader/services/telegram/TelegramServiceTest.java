package tw.gc.basis.trader.services.telegram;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import tw.gc.basis.trader.config.TelegramProperties;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TelegramServiceTest {

    @Mock(lenient = true) private RestTemplate restTemplate;

    private TelegramProperties telegramProperties;
    private TelegramService telegramService;

    @BeforeEach
    void setUp() {
        telegramProperties = new TelegramProperties();
        telegramProperties.setBotToken("test-token");
        telegramProperties.setChatId("123");
        telegramService = new TelegramService(restTemplate, telegramProperties);
    }

    @Test
    void disabledByDefault_shouldNotSend() {
        telegramService.sendMessage("hello");

        assertThat(telegramService.isEnabled()).isFalse();
        verifyNoInteractions(restTemplate);
    }

    @Test
    @SuppressWarnings("unchecked")
    void enabled_shouldPostChatIdAndText() {
        telegramProperties.setEnabled(true);

        telegramService.sendMessage("[BTC] STOP LOSS ALERT");

        ArgumentCaptor<Object> request = ArgumentCaptor.forClass(Object.class);
        verify(restTemplate).postForObject(eq("https://api.telegram.org/bottest-token/sendMessage"),
                request.capture(), eq(String.class));
        Map<String, Object> body = ((HttpEntity<Map<String, Object>>) request.getValue()).getBody();
        assertThat(body).containsEntry("chat_id", "123").containsEntry("text", "[BTC] STOP LOSS ALERT");
    }

    @Test
    void sendFailure_shouldNotPropagate() {
        telegramProperties.setEnabled(true);
        when(restTemplate.postForObject(anyString(), any(), eq(String.class)))
                .thenThrow(new ResourceAccessException("timeout"));

        assertDoesNotThrow(() -> telegramService.sendMessage("hello"));
    }
}
