package io.jobs4j.loop;

@FunctionalInterface
public interface LoopBody {
    void run() throws Exception;
}
