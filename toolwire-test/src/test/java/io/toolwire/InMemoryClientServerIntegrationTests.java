/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.toolwire;

import io.toolwire.spec.McpClientTransportProvider;
import io.toolwire.spec.McpServerTransportProvider;
import io.toolwire.transport.inmemory.InMemoryClientTransportProvider;
import io.toolwire.transport.inmemory.InMemoryServerTransportProvider;

class InMemoryClientServerIntegrationTests extends AbstractMcpClientServerIntegrationTests {

	@Override
	protected McpServerTransportProvider createServerTransportProvider() {
		return new InMemoryServerTransportProvider();
	}

	@Override
	protected McpClientTransportProvider createClientTransportProvider(
			McpServerTransportProvider serverTransportProvider) {
		return new InMemoryClientTransportProvider((InMemoryServerTransportProvider) serverTransportProvider);
	}

}
