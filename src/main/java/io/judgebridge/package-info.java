/**
 * Judge bridge source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.judgebridge.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.judgebridge.server.JudgeServer} accepts judge connections.</li>
 *   <li>{@code io.judgebridge.session.JudgeSession} runs the per-judge protocol: handshake,
 *       dispatch, grading lifecycle, heartbeats and failure handling.</li>
 *   <li>{@code io.judgebridge.session.JudgeRegistry} is the pool the scheduler picks judges from.</li>
 * </ul>
 */
package io.judgebridge;
