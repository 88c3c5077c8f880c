package com.workshopos.service;

import com.workshopos.domain.TrainingPortal;

/** Decides whether a user may be given another workshop session in a portal. */
public interface AdmissionPolicy {

    boolean isPermitted(TrainingPortal portal, String user);
}
