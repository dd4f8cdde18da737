package io.parlance.core.verb.builtin;

import io.parlance.core.exception.VerbExecutionException;
import io.parlance.core.value.Value;
import io.parlance.core.verb.Role;
import io.parlance.core.verb.Verb;
import io.parlance.core.verb.VerbInstance;
import java.util.Set;
import java.util.logging.Logger;

/// `SEND message TO recipient [WITH subject].` Simulated delivery: logs the message.
public final class SendEmail implements Verb {

    private static final Logger logger = Logger.getLogger(SendEmail.class.getName());

    @Override
    public String name() {
        return "SEND";
    }

    @Override
    public String usage() {
        return "Email";
    }

    @Override
    public Set<Role> roles() {
        return Set.of(Role.WHAT, Role.TO, Role.WITH);
    }

    @Override
    public Set<Role> optionalRoles() {
        return Set.of(Role.WITH);
    }

    @Override
    public Value act(VerbInstance instance) throws VerbExecutionException {
        String recipient = instance.text(Role.TO);
        String subject = instance.value(Role.WITH).map(Value::asText).orElse("(no subject)");
        String message = instance.text(Role.WHAT);
        logger.info(
                () -> "Sending email to " + recipient + " [" + subject + "]: " + message);
        return Value.text("Email sent to " + recipient);
    }
}
