package io.judgebridge.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

public sealed interface InboundMessage {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R handshake(Handshake message);

        R submissionAcknowledged(SubmissionAcknowledged message);

        R gradingBegin(GradingBegin message);

        R gradingEnd(GradingEnd message);

        R compileError(CompileError message);

        R compileMessage(CompileMessage message);

        R batchBegin(BatchBegin message);

        R batchEnd(BatchEnd message);

        R testCaseStatus(TestCaseStatus message);

        R internalError(InternalError message);

        R submissionTerminated(SubmissionTerminated message);

        R pingResponse(PingResponse message);

        R supportedProblems(SupportedProblems message);

        R unrecognized(Unrecognized message);
    }

    // Fields are null when the worker omitted them.
    record Handshake(String id, String key, List<String> problems, Map<String, JsonNode> executors)
            implements InboundMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.handshake(this);
        }
    }

    record SubmissionAcknowledged(String submissionId) implements InboundMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.submissionAcknowledged(this);
        }
    }

    record GradingBegin(String submissionId, boolean pretested) implements InboundMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.gradingBegin(this);
        }
    }

    record GradingEnd(String submissionId) implements InboundMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.gradingEnd(this);
        }
    }

    record CompileError(String submissionId, String log) implements InboundMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.compileError(this);
        }
    }

    record CompileMessage(String submissionId, String log) implements InboundMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.compileMessage(this);
        }
    }

    record BatchBegin(String submissionId, Integer batchNo) implements InboundMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.batchBegin(this);
        }
    }

    record BatchEnd(String submissionId) implements InboundMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.batchEnd(this);
        }
    }

    record TestCaseStatus(String submissionId, List<JsonNode> cases) implements InboundMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.testCaseStatus(this);
        }
    }

    record InternalError(String submissionId, String message) implements InboundMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.internalError(this);
        }
    }

    record SubmissionTerminated(String submissionId) implements InboundMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.submissionTerminated(this);
        }
    }

    // when: dispatcher time echoed from the ping. time: worker clock at reply.
    record PingResponse(double when, double time, double load) implements InboundMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.pingResponse(this);
        }
    }

    record SupportedProblems(List<String> problems) implements InboundMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.supportedProblems(this);
        }
    }

    record Unrecognized(String name, String raw, String reason) implements InboundMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.unrecognized(this);
        }
    }
}
