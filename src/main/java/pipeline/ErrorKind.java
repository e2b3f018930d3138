package pipeline;

/** Why a render or export did not produce output. */
public enum ErrorKind {
    NO_SOURCE, DECODE, KERNEL, OUT_OF_MEMORY, IO
}
