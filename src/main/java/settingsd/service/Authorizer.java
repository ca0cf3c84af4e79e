package settingsd.service;

@FunctionalInterface
public interface Authorizer {

    boolean authorize(String subject, String actionId, boolean interactive);

    static Authorizer allowAll() {
        return (subject, actionId, interactive) -> true;
    }

    static Authorizer denyAll() {
        return (subject, actionId, interactive) -> false;
    }
}
