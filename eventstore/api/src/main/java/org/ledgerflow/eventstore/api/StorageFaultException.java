/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.ledgerflow.eventstore.api;

/**
 * A stored event could not be read back, for example because its payload is not valid JSON or lacks a required field.
 * The read fails as a whole; no partial result is returned.
 */
public class StorageFaultException extends RuntimeException {

    public StorageFaultException(String message) {
        super(message);
    }

    public StorageFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
