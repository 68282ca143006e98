package com.example.skillsmatrix.service.staging;

/**
 * Work experience after mapping: either a resolved ordinal code or the descriptor the
 * mapping table did not know.
 */
public sealed interface WorkExperience permits WorkExperience.Ordinal, WorkExperience.Unmapped {

    boolean isMapped();

    record Ordinal(int code) implements WorkExperience {
        @Override
        public boolean isMapped() {
            return true;
        }
    }

    record Unmapped(String descriptor) implements WorkExperience {
        @Override
        public boolean isMapped() {
            return false;
        }
    }
}
