package com.agentflow.core.store;

class InMemoryOrchestrationStoreTest extends OrchestrationStoreContractTest {

    @Override
    protected OrchestrationStore createStore() {
        return new InMemoryOrchestrationStore();
    }
}
