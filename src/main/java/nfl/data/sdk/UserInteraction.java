package nfl.data.sdk;

/**
 * Запрашивает подтверждение пользователя перед разрушительными операциями.
 */
public interface UserInteraction {

    /**
     * @return {@code true} только при явном согласии
     */
    boolean confirm(String question);

    /** Никогда не спрашивает, всегда отказывает. */
    UserInteraction DENY = question -> false;
}
