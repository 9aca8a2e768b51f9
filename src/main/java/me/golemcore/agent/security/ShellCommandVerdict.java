package me.golemcore.agent.security;

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
 * Decision of {@link ShellCommandPolicy}. {@code kind} and {@code reason} are
 * null when the command is allowed.
 */
public record ShellCommandVerdict(boolean allowed, ShellRejectionKind kind, String reason) {

    private static final ShellCommandVerdict ALLOWED = new ShellCommandVerdict(true, null, null);

    public static ShellCommandVerdict allow() {
        return ALLOWED;
    }

    public static ShellCommandVerdict reject(ShellRejectionKind kind, String reason) {
        return new ShellCommandVerdict(false, kind, reason);
    }
}
