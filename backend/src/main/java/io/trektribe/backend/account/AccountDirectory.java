package io.trektribe.backend.account;

import java.util.Optional;

/** Read-only view of the account subsystem, used to address email mirrors. */
public interface AccountDirectory {

  Optional<String> resolveEmailAddress(String userId);
}
