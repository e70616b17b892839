package com.automate.CodeAudit.jobs;

import com.automate.CodeAudit.Config.CodeAuditProperties;
import com.automate.CodeAudit.entity.UserRole;
import com.automate.CodeAudit.entity.UsersEntity;
import com.automate.CodeAudit.repository.UsersRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Component
public class AdminBootstrapJob {
    private static final Logger log = LoggerFactory.getLogger(AdminBootstrapJob.class);
    private final UsersRepository usersRepository;
    private final PasswordEncoder passwordEncoder;
    private final CodeAuditProperties properties;

    public AdminBootstrapJob(UsersRepository usersRepository,
                             PasswordEncoder passwordEncoder,
                             CodeAuditProperties properties) {
        this.usersRepository = usersRepository;
        this.passwordEncoder = passwordEncoder;
        this.properties = properties;
    }

    /** Creates the first admin account on an empty database. */
    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void createAdminIfEmpty() {
        if (usersRepository.count() > 0) {
            return;
        }
        CodeAuditProperties.Admin admin = properties.getAdmin();
        if (admin.getPassword() == null || admin.getPassword().isBlank()) {
            log.warn("No user in database and no admin password configured (codeaudit.admin.password)");
            return;
        }
        UsersEntity user = new UsersEntity();
        user.setUserId(UUID.randomUUID());
        user.setUsername(admin.getUsername());
        user.setPassword(passwordEncoder.encode(admin.getPassword()));
        user.setRole(UserRole.ADMIN);
        usersRepository.save(user);
        log.info("Admin account created: {}", admin.getUsername());
    }
}
