package me.golemcore.gm.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Answer of the branch handler to a request to start an opportunity.
 *
 * @param success
 *            whether the branch was started
 * @param message
 *            human readable message from the branch handler
 * @param newBranchId
 *            id of the started branch, when successful
 * @param rejectionReason
 *            machine-readable reason when rejected; see
 *            {@link BranchRejectionReason}
 */
public record BranchInitiationResult(boolean success, String message, String newBranchId, String rejectionReason) {

    public static BranchInitiationResult started(String newBranchId, String message) {
        return new BranchInitiationResult(true, message, newBranchId, null);
    }

    public static BranchInitiationResult rejected(BranchRejectionReason reason, String message) {
        return new BranchInitiationResult(false, message, null, reason.value());
    }
}
