package com.example.timesheet.user;

import com.example.timesheet.exception.ResourceNotFoundException;
import com.example.timesheet.exception.RuleViolation;
import com.example.timesheet.exception.RuleViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Identity collaborator. Turns the caller's user id into an {@link Actor}; authentication
 * happens upstream.
 */
@Service
@Transactional(readOnly = true)
public class UserDirectory {

    /** Request header carrying the caller's user id. */
    public static final String USER_ID_HEADER = "X-User-Id";

    private static final Logger logger = LoggerFactory.getLogger(UserDirectory.class);

    private final UserAccountRepository userAccountRepository;

    public UserDirectory(UserAccountRepository userAccountRepository) {
        this.userAccountRepository = userAccountRepository;
    }

    public Actor resolve(Long userId) {
        UserAccount account = userAccountRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
        if (!account.isActive()) {
            logger.warn("Inactive user {} attempted an operation", userId);
            throw new RuleViolationException(new RuleViolation.Forbidden(null, userId));
        }
        return account.toActor();
    }
}
