package com.example.timesheet.user;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Seeds one administrator and one employee so a fresh instance can be exercised through
 * the {@code X-User-Id} header.
 */
@Component
@Profile("!test")
public class UserDataInitializer implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(UserDataInitializer.class);

    private final UserAccountRepository userAccountRepository;

    public UserDataInitializer(UserAccountRepository userAccountRepository) {
        this.userAccountRepository = userAccountRepository;
    }

    @Override
    public void run(String... args) {
        if (!userAccountRepository.existsByEmail("admin@example.com")) {
            UserAccount admin = userAccountRepository.save(new UserAccount("Administrator", "admin@example.com", Role.ADMIN));
            logger.info("Created default administrator: ID={}", admin.getId());
        }
        if (!userAccountRepository.existsByEmail("employee@example.com")) {
            UserAccount employee = userAccountRepository.save(new UserAccount("Employee", "employee@example.com", Role.EMPLOYEE));
            logger.info("Created default employee: ID={}", employee.getId());
        }
        logger.info("User data initialization finished");
    }
}
