/**
 *  Copyright 2026 The Aard Dictionary contributors
 *
 *   Licensed under the Apache License, Version 2.0 (the "License");
 *   you may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */
package org.aarddict.tools.wiki;

/**
 * Exception that is thrown if a configuration file or option is missing or
 * invalid. Configuration errors are fatal: they abort the run before any
 * article is processed.
 */
public class ConfigurationException extends Exception {
    /**
     * class version for serialisation
     */
    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception with the given message.
     * 
     * @param msg
     *            message of the exception
     */
    public ConfigurationException(String msg) {
        super(msg);
    }

    /**
     * Creates the exception with the given message and cause.
     * 
     * @param msg
     *            message of the exception
     * @param cause
     *            the exception that caused the failure
     */
    public ConfigurationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
