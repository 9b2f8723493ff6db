package ru.oparin.calendar.service.telegram;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import reactor.core.publisher.Mono;
import ru.oparin.calendar.config.properties.TelegramBotProperties;

import java.time.Duration;

/**
 * Отправка сообщений через Telegram Bot API.
 * В личных чатах ID чата совпадает с ID пользователя, поэтому адресатом служит ID пользователя.
 */
@Service
@Slf4j
public class TelegramMessageService {

    private final WebClient webClient;
    private final TelegramKeyboardFactory keyboardFactory;
    private final Duration timeout;

    public TelegramMessageService(WebClient.Builder webClientBuilder,
                                  TelegramBotProperties properties,
                                  TelegramKeyboardFactory keyboardFactory) {
        this.webClient = webClientBuilder.clone()
                .baseUrl(properties.getApiUrl() + properties.getToken())
                .build();
        this.keyboardFactory = keyboardFactory;
        this.timeout = properties.getTimeout();
    }

    /**
     * Отправить текстовое сообщение.
     *
     * @param chatId ID чата
     * @param text   текст сообщения
     * @return результат отправки
     */
    public Mono<Void> sendMessage(Long chatId, String text) {
        return sendMessage(chatId, text, null);
    }

    /**
     * Отправить сообщение с клавиатурой (inline или обычной).
     *
     * @param chatId   ID чата
     * @param text     текст сообщения
     * @param keyboard клавиатура или null
     * @return результат отправки
     */
    public Mono<Void> sendMessage(Long chatId, String text, ReplyKeyboard keyboard) {
        log.info("Отправка сообщения в чат {}", chatId);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("chat_id", String.valueOf(chatId));
        body.add("text", text);
        if (keyboard != null) {
            body.add("reply_markup", keyboardFactory.toJson(keyboard));
        }

        return post("/sendMessage", body)
                .doOnSuccess(v -> log.debug("Сообщение отправлено в чат {}", chatId))
                .doOnError(error -> log.error("Ошибка отправки сообщения в чат {}: {}", chatId, error.getMessage()));
    }

    /**
     * Ответить на callback query, чтобы у пользователя пропал индикатор загрузки на кнопке.
     *
     * @param callbackQueryId ID callback query
     * @param text            короткое всплывающее уведомление или null
     */
    public Mono<Void> answerCallbackQuery(String callbackQueryId, String text) {
        log.debug("Отправка ответа на callback query: {}", callbackQueryId);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("callback_query_id", callbackQueryId);
        if (text != null) {
            body.add("text", text);
        }

        return post("/answerCallbackQuery", body)
                .doOnError(error -> log.warn("Ошибка ответа на callback query {}: {}", callbackQueryId, error.getMessage()));
    }

    /**
     * Убрать inline-кнопки у ранее отправленного сообщения.
     */
    public Mono<Void> removeInlineKeyboard(Long chatId, Long messageId) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("chat_id", String.valueOf(chatId));
        body.add("message_id", String.valueOf(messageId));
        body.add("reply_markup", keyboardFactory.toJson(keyboardFactory.emptyInlineKeyboard()));

        return post("/editMessageReplyMarkup", body)
                .doOnError(error -> log.warn("Не удалось убрать кнопки у сообщения {} в чате {}: {}",
                        messageId, chatId, error.getMessage()));
    }

    private Mono<Void> post(String method, MultiValueMap<String, String> body) {
        return webClient.post()
                .uri(method)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(body))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .then();
    }
}
