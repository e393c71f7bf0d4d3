package com.hhplus.checkout.domain.settings;

import java.util.Optional;

public interface ProcessorCredentialRepository {

    Optional<ProcessorCredential> find();

    ProcessorCredential save(ProcessorCredential credential);
}
