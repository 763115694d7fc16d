package ilhost.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NoApplicableOverloadException 诊断信息")
class NoApplicableOverloadExceptionTest {

    @Test
    @DisplayName("noMatch 列出全部候选")
    void noMatchListsCandidates() {
        NoApplicableOverloadException e = NoApplicableOverloadException.noMatch(
                Arrays.asList("void F(System.Int32)", "void F(System.String)"));
        assertThat(e.getMessage())
                .startsWith("2 candidate(s) for method invocation:")
                .contains("void F(System.Int32)")
                .contains("void F(System.String)");
        assertThat(e.getCandidates()).hasSize(2);
        assertThat(e).isInstanceOf(IlHostException.class);
    }

    @Test
    @DisplayName("noArity 给出方法名与实参数量")
    void noArityNamesMethod() {
        NoApplicableOverloadException e = NoApplicableOverloadException.noArity("F", 3,
                Arrays.asList("void F()"));
        assertThat(e.getMessage()).isEqualTo("No overload of F can accept 3 argument(s).");
    }
}
