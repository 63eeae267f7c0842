package dev.promptbench.provider.openai;

import com.openai.errors.BadRequestException;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIInvalidDataException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.errors.PermissionDeniedException;
import com.openai.errors.RateLimitException;
import com.openai.errors.UnauthorizedException;
import dev.promptbench.provider.ProviderException;
import dev.promptbench.provider.ProviderException.Kind;
import java.io.InterruptedIOException;
import java.util.concurrent.TimeoutException;

/** Maps openai-java failures onto {@link ProviderException} kinds. */
final class OpenAIErrors {
    private OpenAIErrors() {}

    static ProviderException classify(OpenAIException e) {
        var message = String.valueOf(e.getMessage());
        if (e instanceof RateLimitException) {
            if (message.contains("exceeded your current quota")) {
                return new ProviderException(Kind.QUOTA_EXCEEDED, message, e);
            }
            return new ProviderException(Kind.RATE_LIMITED, message, e);
        } else if (e instanceof UnauthorizedException || e instanceof PermissionDeniedException) {
            return new ProviderException(Kind.AUTHENTICATION, message, e);
        } else if (e instanceof BadRequestException) {
            if (message.contains("maximum context length")) {
                return new ProviderException(Kind.CONTEXT_LENGTH_EXCEEDED, message, e);
            }
            return new ProviderException(Kind.BAD_REQUEST, message, e);
        } else if (e instanceof OpenAIServiceException serviceException) {
            return new ProviderException(
                    Kind.API_ERROR,
                    "status %d: %s".formatted(serviceException.statusCode(), message),
                    e);
        } else if (e instanceof OpenAIIoException && isTimeout(e)) {
            return new ProviderException(Kind.TIMEOUT, message, e);
        } else if (e instanceof OpenAIInvalidDataException) {
            return new ProviderException(Kind.MALFORMED_RESPONSE, message, e);
        }
        return new ProviderException(Kind.API_ERROR, message, e);
    }

    private static boolean isTimeout(Throwable error) {
        for (var cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof InterruptedIOException || cause instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }
}
