package io.trektribe.backend.account;

import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class RepositoryAccountDirectory implements AccountDirectory {

  private final UserAccountRepository userAccountRepository;

  public RepositoryAccountDirectory(UserAccountRepository userAccountRepository) {
    this.userAccountRepository = userAccountRepository;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<String> resolveEmailAddress(String userId) {
    return userAccountRepository
        .findById(userId)
        .map(UserAccount::getEmail)
        .filter(email -> !email.isBlank());
  }
}
