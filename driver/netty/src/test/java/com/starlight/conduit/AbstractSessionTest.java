// Copyright (c) 2010 Rob Eden.
// All rights reserved.
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are met:
//     * Redistributions of source code must retain the above copyright
//       notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above copyright
//       notice, this list of conditions and the following disclaimer in the
//       documentation and/or other materials provided with the distribution.
//     * Neither the name of Intrepid nor the
//       names of its contributors may be used to endorse or promote products
//       derived from this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
// ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
// WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
// DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
// DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
// (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
// LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
// ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
// SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.

package com.starlight.conduit;

import com.starlight.conduit.driver.netty.NettyConduitDriver;
import com.starlight.conduit.exception.ConnectionFailureException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;


/**
 * Client/server tests run over each transport.
 */
public abstract class AbstractSessionTest {
	private final List<ConduitSession> clients = new ArrayList<>();
	private final List<NettyConduitDriver> client_drivers = new ArrayList<>();
	private final List<RemoteObject> to_release = new ArrayList<>();

	private HandlerRegistry registry;
	private NettyConduitDriver server_driver;
	private ConduitServer server;
	private TestService service;
	private Endpoint endpoint;


	/**
	 * Create an endpoint no server is listening on.
	 */
	protected abstract Endpoint createEndpoint() throws IOException;


	@BeforeEach
	public void setUp() throws Exception {
		Endpoint requested = createEndpoint();

		registry = new HandlerRegistry();
		TestService.register( registry );

		service = new TestService( registry );

		server_driver = new NettyConduitDriver();
		server = ConduitServer.newBuilder()
			.driver( server_driver )
			.build();
		server.setRootObject( service, true );
		endpoint = server.bind( requested );
		server.start();
	}


	@AfterEach
	public void tearDown() throws Exception {
		to_release.forEach( Conduit::release );

		for( ConduitSession client : clients ) {
			client.shutdown( true );
		}
		if ( server != null ) {
			server.shutdown();
			server.join();
			assertEquals( 0, server_driver.getOpenChannelCount() );
		}
		for( NettyConduitDriver driver : client_drivers ) {
			assertEquals( 0, driver.getOpenChannelCount() );
		}
		if ( service != null ) service.release();
	}


	@Test
	public void pingAndDescriptor() throws Exception {
		ConduitSession client = connect( 0 );
		RemoteObject root = root( client );

		assertTrue( root.isRemote() );
		assertEquals( Status.OK, root.ping() );
		assertEquals( TestService.DESCRIPTOR, root.getInterfaceDescriptor() );
		assertEquals( 1, server.listSessions().size() );
		assertEquals( client.getSessionID(), server.listSessions().get( 0 ).getSessionID() );
		assertNotEquals( 0, client.getSessionID() );

		// A second session to the same server
		ConduitSession second = connect( 0 );
		assertNotEquals( client.getSessionID(), second.getSessionID() );
		assertEquals( Status.OK, root( second ).ping() );
		assertEquals( 2, server.listSessions().size() );
	}


	@Test
	public void echo() throws Exception {
		RemoteObject root = root( connect( 0 ) );

		StringBuilder large = new StringBuilder();
		for( int i = 0; i < 64 * 1024; i++ ) {
			large.append( ( char ) ( 'a' + i % 26 ) );
		}

		for( String value : new String[] { "hello", "", null, large.toString() } ) {
			try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
				data.writeString( value );
				assertEquals( Status.OK, root.transact( TestService.ECHO, data, reply, 0 ) );
				assertEquals( value, reply.readString() );
			}
		}
	}


	@Test
	public void statusCodes() throws Exception {
		RemoteObject root = root( connect( 0 ) );

		assertEquals( TestService.STATUS_CUSTOM, callFail( root, TestService.STATUS_CUSTOM ) );
		assertEquals( Status.BAD_VALUE, callFail( root, Status.BAD_VALUE ) );
		assertEquals( Status.UNKNOWN_ERROR, callFail( root, Status.UNKNOWN_ERROR ) );

		try( Parcel data = new Parcel() ) {
			assertEquals( Status.UNKNOWN_TRANSACTION,
				root.transact( RemoteObject.LAST_CALL_TRANSACTION, data, null, 0 ) );
		}

		// Errors do not affect later calls
		assertEquals( Status.OK, root.ping() );
	}


	@Test
	public void rootObjectIsStable() throws Exception {
		ConduitSession client = connect( 0 );
		RemoteObject first = root( client );
		RemoteObject second = client.getRootObject();
		try {
			assertSame( first, second );
		}
		finally {
			Conduit.release( second );
		}
	}


	@Test
	public void sameObjectSentTwice() throws Exception {
		RemoteObject root = root( connect( 0 ) );
		TestService.TestCallback callback = new TestService.TestCallback( registry );

		try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
			data.writeStrongBinder( callback );
			data.writeStrongBinder( callback );
			assertEquals( Status.OK,
				root.transact( TestService.SAME_BINDER, data, reply, 0 ) );

			assertTrue( reply.readBoolean() );
			// Returned to its owner as the object itself
			assertSame( callback, reply.readStrongBinder() );
		}

		assertEventually( () -> callback.refCnt() == 1,
			"Server did not release the callback" );
		callback.release();
	}


	@Test
	public void nullBinder() throws Exception {
		RemoteObject root = root( connect( 0 ) );

		try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
			data.writeStrongBinder( null );
			data.writeStrongBinder( null );
			assertEquals( Status.OK,
				root.transact( TestService.SAME_BINDER, data, reply, 0 ) );
			assertTrue( reply.readBoolean() );
			assertNull( reply.readStrongBinder() );
		}

		// A call through a missing callback
		try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
			writeCallBack( data, null, false, false );
			assertEquals( Status.OK,
				root.transact( TestService.CALL_BACK, data, reply, 0 ) );
			assertEquals( Status.UNEXPECTED_NULL, reply.readInt() );
		}
	}


	@ParameterizedTest( name = "reverse threads={0}, one-way={1}, delayed={2}" )
	@CsvSource( {
		"0, false, false, true",
		"0, true,  false, false",
		"0, false, true,  false",
		"0, true,  true,  false",
		"1, false, false, true",
		"1, true,  false, true",
		"1, false, true,  true",
		"1, true,  true,  true"
	} )
	public void callbacks( int reverse_threads, boolean oneway, boolean delayed,
		boolean expect_success ) throws Exception {

		ConduitSession client = connect( reverse_threads );
		assertEquals( reverse_threads, client.getMaxReverseThreads() );
		RemoteObject root = root( client );
		TestService.TestCallback callback = new TestService.TestCallback( registry );

		try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
			writeCallBack( data, callback, oneway, delayed );
			assertEquals( Status.OK,
				root.transact( TestService.CALL_BACK, data, reply, 0 ) );

			if ( !oneway && !delayed ) {
				assertEquals( Status.OK, reply.readInt() );
				assertEquals( 10, reply.readInt() );
				assertEquals( List.of( true ), callback.received_in_call );
			}
		}

		assertEventually( () -> service.callback_status.get() != null,
			"Callback was not attempted" );
		if ( expect_success ) {
			assertEquals( Status.OK, service.callback_status.get().intValue() );
			assertEventually( () -> callback.received.equals( List.of( 5 ) ),
				"Callback did not run" );
		}
		else {
			assertEquals( Status.WOULD_BLOCK, service.callback_status.get().intValue() );
			assertTrue( callback.received.isEmpty() );
		}

		callback.release();
	}


	@Test
	public void nestedCalls() throws Exception {
		RemoteObject root = root( connect( 0 ) );
		TestService.TestCallback callback = new TestService.TestCallback( registry );

		try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
			data.writeInt( 10 );
			data.writeStrongBinder( callback );
			assertEquals( Status.OK, root.transact( TestService.NEST, data, reply, 0 ) );
			assertEquals( 10, reply.readInt() );
		}
		callback.release();
	}


	@Test
	public void onewayCallsRunInOrder() throws Exception {
		RemoteObject root = root( connect( 0 ) );

		for( int i = 0; i < 500; i++ ) {
			try( Parcel data = new Parcel() ) {
				data.writeInt( i );
				assertEquals( Status.OK, root.transact( TestService.APPEND, data, null,
					RemoteObject.FLAG_ONEWAY ) );
			}
		}

		// A two-way call runs after the one-way calls sent before it
		try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
			assertEquals( Status.OK,
				root.transact( TestService.GET_APPENDED, data, reply, 0 ) );
			assertEquals( 500, reply.readInt() );
			for( int i = 0; i < 500; i++ ) {
				assertEquals( i, reply.readInt() );
			}
		}
	}


	@Test
	public void concurrentOnewayCallsRunInOrder() throws Exception {
		server.setMaxThreads( 4 );
		RemoteObject root = root( connect( 1 ) );

		ExecutorService callers = Executors.newFixedThreadPool( 4 );
		try {
			List<Future<Boolean>> results = new ArrayList<>();
			for( int t = 0; t < 4; t++ ) {
				int base = t * 100_000;
				results.add( callers.submit( () -> {
					for( int i = 0; i < 500; i++ ) {
						try( Parcel data = new Parcel() ) {
							data.writeInt( base + i );
							int status = root.transact( TestService.APPEND, data, null,
								RemoteObject.FLAG_ONEWAY );
							if ( status != Status.OK ) return false;
						}

						if ( i % 50 == 49 ) {
							// The blocking call sees every one-way call made before it
							try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
								int status = root.transact( TestService.GET_APPENDED, data,
									reply, 0 );
								if ( status != Status.OK ) return false;
								if ( !readAppended( reply ).contains( base + i ) ) return false;
							}
						}
						else if ( i % 7 == 0 ) {
							try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
								data.writeString( "ping" );
								int status = root.transact( TestService.ECHO, data, reply, 0 );
								if ( status != Status.OK ) return false;
							}
						}
					}
					return true;
				} ) );
			}

			for( Future<Boolean> result : results ) {
				assertTrue( result.get( 60, TimeUnit.SECONDS ) );
			}
		}
		finally {
			callers.shutdownNow();
		}

		List<Integer> appended;
		try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
			assertEquals( Status.OK,
				root.transact( TestService.GET_APPENDED, data, reply, 0 ) );
			appended = readAppended( reply );
		}
		assertEquals( 2000, appended.size() );

		int[] last = { -1, -1, -1, -1 };
		for( int value : appended ) {
			int thread = value / 100_000;
			int index = value % 100_000;
			assertEquals( last[ thread ] + 1, index,
				"Call " + index + " from caller " + thread + " ran out of order" );
			last[ thread ] = index;
		}
	}


	@Test
	public void concurrentCallsWithoutReverseThreads() throws Exception {
		server.setMaxThreads( 4 );
		ConduitSession client = connect( 0 );
		RemoteObject root = root( client );

		ExecutorService callers = Executors.newFixedThreadPool( 4 );
		try {
			List<Future<Integer>> results = new ArrayList<>();
			for( int t = 0; t < 4; t++ ) {
				results.add( callers.submit( () -> {
					int failures = 0;
					for( int i = 0; i < 2000; i++ ) {
						try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
							data.writeString( "call " + i );
							if ( root.transact( TestService.ECHO, data, reply, 0 ) != Status.OK ||
								!( "call " + i ).equals( reply.readString() ) ) {

								failures++;
							}
						}
					}
					return failures;
				} ) );
			}

			for( Future<Integer> result : results ) {
				assertEquals( 0, result.get( 60, TimeUnit.SECONDS ).intValue() );
			}
		}
		finally {
			callers.shutdownNow();
		}

		assertTrue( client.isAlive() );
		assertEquals( Status.OK, root.ping() );
	}


	@Test
	public void onewayCallDoesNotWait() throws Exception {
		RemoteObject root = root( connect( 0 ) );

		long start = System.nanoTime();
		try( Parcel data = new Parcel() ) {
			data.writeInt( 1000 );
			assertEquals( Status.OK, root.transact( TestService.SLEEP, data, null,
				RemoteObject.FLAG_ONEWAY ) );
		}
		assertTrue( TimeUnit.NANOSECONDS.toMillis( System.nanoTime() - start ) < 500 );
	}


	@Test
	public void onewayFloodEndsOnlyThatSession() throws Exception {
		TestService flood_service = new TestService( registry );
		NettyConduitDriver flood_driver = new NettyConduitDriver();
		ConduitServer flood_server = ConduitServer.newBuilder()
			.driver( flood_driver )
			.maxThreads( 2 )
			.onewayQueueCapacity( 5 )
			.build();
		try {
			flood_server.setRootObject( flood_service, true );
			Endpoint flood_endpoint = flood_server.bind( createEndpoint() );
			flood_server.start();

			ConduitSession flooder = connect( flood_endpoint, 0 );
			ConduitSession bystander = connect( flood_endpoint, 0 );
			RemoteObject flooder_root = root( flooder );
			RemoteObject bystander_root = root( bystander );

			try( Parcel data = new Parcel() ) {
				flooder_root.transact( TestService.BLOCK, data, null,
					RemoteObject.FLAG_ONEWAY );
			}
			assertEventually( () -> flood_service.blocked.get() == 1,
				"One-way call did not start" );

			for( int i = 0; i < 50 && flooder.isAlive(); i++ ) {
				try( Parcel data = new Parcel() ) {
					data.writeInt( i );
					flooder_root.transact( TestService.APPEND, data, null,
						RemoteObject.FLAG_ONEWAY );
				}
			}

			assertEventually( () -> !flooder.isAlive(), "Flooding session is still alive" );
			assertEquals( Status.DEAD_OBJECT, flooder_root.ping() );

			flood_service.unblock.countDown();
			assertEquals( Status.OK, bystander_root.ping() );
			assertTrue( bystander.isAlive() );
		}
		finally {
			flood_service.unblock.countDown();
			flood_server.shutdown();
			flood_server.join();
			flood_service.release();
		}
		assertEquals( 0, flood_driver.getOpenChannelCount() );
	}


	@Test
	public void concurrentCalls() throws Exception {
		server.setMaxThreads( 4 );
		ConduitSession client = connect( 0 );
		assertEquals( 4, client.getMaxThreads() );
		RemoteObject root = root( client );

		service.barrier = new CyclicBarrier( 4 );
		ExecutorService callers = Executors.newFixedThreadPool( 4 );
		try {
			List<Future<Integer>> results = new ArrayList<>();
			for( int i = 0; i < 4; i++ ) {
				results.add( callers.submit( () -> {
					try( Parcel data = new Parcel() ) {
						return root.transact( TestService.BARRIER, data, null, 0 );
					}
				} ) );
			}

			for( Future<Integer> result : results ) {
				assertEquals( Status.OK, result.get( 20, TimeUnit.SECONDS ).intValue() );
			}
		}
		finally {
			callers.shutdownNow();
		}
	}


	@Test
	public void stress() throws Exception {
		server.setMaxThreads( 4 );
		RemoteObject root = root( connect( 0 ) );

		ExecutorService callers = Executors.newFixedThreadPool( 8 );
		try {
			List<Future<Boolean>> results = new ArrayList<>();
			for( int t = 0; t < 8; t++ ) {
				String prefix = "caller " + t + ": ";
				results.add( callers.submit( () -> {
					for( int i = 0; i < 100; i++ ) {
						try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
							data.writeString( prefix + i );
							int status = root.transact( TestService.ECHO, data, reply, 0 );
							if ( status != Status.OK ) return false;
							if ( !( prefix + i ).equals( reply.readString() ) ) return false;
						}
					}
					return true;
				} ) );
			}

			for( Future<Boolean> result : results ) {
				assertTrue( result.get( 60, TimeUnit.SECONDS ) );
			}
		}
		finally {
			callers.shutdownNow();
		}
	}


	@Test
	public void threadPoolLeavesRoomForPing() throws Exception {
		server.setMaxThreads( 10 );
		RemoteObject root = root( connect( 0 ) );

		ExecutorService callers = Executors.newFixedThreadPool( 9 );
		try {
			List<Future<Integer>> results = new ArrayList<>();
			for( int i = 0; i < 9; i++ ) {
				results.add( callers.submit( () -> {
					try( Parcel data = new Parcel() ) {
						return root.transact( TestService.BLOCK, data, null, 0 );
					}
				} ) );
			}
			assertEventually( () -> service.blocked.get() == 9, "Calls did not block" );

			assertEquals( Status.OK, root.ping() );

			service.unblock.countDown();
			for( Future<Integer> result : results ) {
				assertEquals( Status.OK, result.get( 10, TimeUnit.SECONDS ).intValue() );
			}
		}
		finally {
			service.unblock.countDown();
			callers.shutdownNow();
		}
	}


	@Test
	public void callsWaitForFreeThreads() throws Exception {
		server.setMaxThreads( 10 );
		RemoteObject root = root( connect( 0 ) );

		ExecutorService callers = Executors.newFixedThreadPool( 13 );
		try {
			long start = System.nanoTime();
			List<Future<Integer>> results = new ArrayList<>();
			for( int i = 0; i < 13; i++ ) {
				results.add( callers.submit( () -> {
					try( Parcel data = new Parcel() ) {
						data.writeInt( 500 );
						return root.transact( TestService.SLEEP, data, null, 0 );
					}
				} ) );
			}
			for( Future<Integer> result : results ) {
				assertEquals( Status.OK, result.get( 10, TimeUnit.SECONDS ).intValue() );
			}
			long elapsed = TimeUnit.NANOSECONDS.toMillis( System.nanoTime() - start );

			// Two rounds: ten calls, then the three that waited
			assertTrue( elapsed >= 1000, "Finished too quickly: " + elapsed );
			assertTrue( elapsed < 2000, "Took too long: " + elapsed );
		}
		finally {
			callers.shutdownNow();
		}
	}


	@Test
	public void threadCountChange() throws Exception {
		ConduitSession client = connect( 0 );
		assertEquals( 1, client.getMaxThreads() );

		server.setMaxThreads( 3 );
		assertEquals( 3, server.getMaxThreads() );
		assertEventually( () -> client.getMaxThreads() == 3,
			"Client did not learn the new thread count" );

		// New connections are opened on demand
		assertEquals( Status.OK, root( client ).ping() );
	}


	@Test
	public void objectLifetimeAcrossSessions() throws Exception {
		ConduitSession client = connect( 0 );
		RemoteObject root = root( client );

		RemoteObject child;
		try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
			assertEquals( Status.OK,
				root.transact( TestService.CREATE_CHILD, data, reply, 0 ) );
			child = reply.readStrongBinder().retain();
		}

		// Held for the client even though the server dropped its own reference
		assertEquals( Status.OK, child.ping() );
		assertEquals( "conduit.test.Child", child.getInterfaceDescriptor() );
		assertEquals( 0, service.children_destroyed.get() );

		child.release();
		assertEventually( () -> service.children_destroyed.get() == 1,
			"Child was not destroyed after the client released it" );
	}


	@Test
	public void liveObjectCounts() throws Exception {
		ConduitSession client = connect( 0 );
		ConduitSession server_session = server.listSessions().get( 0 );

		RemoteObject root = client.getRootObject();
		assertNotNull( root );

		RemoteObject child;
		try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
			assertEquals( Status.OK,
				root.transact( TestService.CREATE_CHILD, data, reply, 0 ) );
			child = reply.readStrongBinder().retain();
		}
		assertEquals( 2, client.countLiveObjects() );
		assertEventually( () -> server_session.countLiveObjects() == 2,
			"Server does not count both objects" );

		child.release();
		assertEquals( 1, client.countLiveObjects() );
		assertEventually( () -> server_session.countLiveObjects() == 1,
			"Server still counts the child" );

		root.release();
		assertEquals( 0, client.countLiveObjects() );
		assertEventually( () -> server_session.countLiveObjects() == 0,
			"Server still counts the root" );
	}


	@Test
	public void weakRootObject() throws Exception {
		LocalObject weak_root = new LocalObject( "conduit.test.WeakRoot", registry );
		server.setRootObject( weak_root, false );

		ConduitSession client = connect( 0 );
		RemoteObject proxy = client.getRootObject();
		assertNotNull( proxy );

		// The proxy keeps the object alive after its creator lets go
		weak_root.release();
		assertEquals( Status.OK, proxy.ping() );

		proxy.release();
		assertEventually( () -> weak_root.refCnt() == 0,
			"Root was not destroyed after the client released it" );
		assertNull( client.getRootObject() );
	}


	@Test
	public void strongRootOutlivesCreator() throws Exception {
		LocalObject strong_root = new LocalObject( "conduit.test.StrongRoot", registry );
		server.setRootObject( strong_root, true );
		strong_root.release();

		RemoteObject proxy = root( connect( 0 ) );
		assertEquals( Status.OK, proxy.ping() );
		assertEquals( "conduit.test.StrongRoot", proxy.getInterfaceDescriptor() );
	}


	@Test
	public void weakReferenceToProxy() throws Exception {
		ConduitSession client = connect( 0 );
		RemoteObject root = client.getRootObject();
		assertNotNull( root );

		WeakObjectRef ref = WeakObjectRef.of( root );
		RemoteObject promoted = ref.promote();
		assertSame( root, promoted );
		promoted.release();

		root.release();
		assertNull( ref.promote() );
		ref.release();

		assertEquals( 0, client.countLiveObjects() );
	}


	@Test
	public void noRootObject() throws Exception {
		server.setRootObject( null, false );
		assertNull( connect( 0 ).getRootObject() );
	}


	@Test
	public void proxyFromAnotherSession() throws Exception {
		RemoteObject first_root = root( connect( 0 ) );
		RemoteObject second_root = root( connect( 0 ) );

		try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
			writeCallBack( data, first_root, false, false );
			assertEquals( Status.INVALID_OPERATION,
				second_root.transact( TestService.CALL_BACK, data, reply, 0 ) );
		}

		// Nothing was left outstanding on either session
		assertEquals( Status.OK, first_root.ping() );
		assertEquals( Status.OK, second_root.ping() );
	}


	@Test
	public void callContext() throws Exception {
		ConduitSession client = connect( 0 );
		RemoteObject root = root( client );

		assertFalse( ConduitContext.isCall() );
		assertNull( ConduitContext.getSession() );
		assertThrows( IllegalStateException.class,
			() -> ConduitContext.runLater( () -> {}, 0, TimeUnit.MILLISECONDS ) );

		try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
			assertEquals( Status.OK,
				root.transact( TestService.DESCRIBE_CONTEXT, data, reply, 0 ) );
			assertTrue( reply.readBoolean() );
			assertFalse( reply.readBoolean() );
			assertTrue( reply.readBoolean() );
			assertEquals( client.getSessionID(), reply.readLong() );
		}
	}


	@Test
	public void clientShutdown() throws Exception {
		ConduitSession client = connect( 0 );
		RemoteObject root = root( client );

		assertTrue( client.shutdown( true ) );
		assertFalse( client.shutdown( true ) );
		assertFalse( client.isAlive() );

		assertEquals( Status.DEAD_OBJECT, root.ping() );
		assertEventually( () -> server.listSessions().isEmpty(),
			"Server still lists the session" );

		// Only the creator and the server's root slot hold the service now
		assertEventually( () -> service.refCnt() == 2,
			"Session did not release the root object" );
	}


	@Test
	public void serverShutdown() throws Exception {
		ConduitSession client = connect( 0 );
		RemoteObject root = root( client );

		long start = System.nanoTime();
		assertTrue( server.shutdown() );
		assertFalse( server.shutdown() );
		assertFalse( server.isRunning() );
		server.join();
		assertTrue( TimeUnit.NANOSECONDS.toMillis( System.nanoTime() - start ) < 2000 );

		assertEventually( () -> !client.isAlive(), "Client session is still alive" );
		assertEquals( Status.DEAD_OBJECT, root.ping() );
		assertEquals( 0, server_driver.getOpenChannelCount() );
		assertThrows( IllegalStateException.class, () -> server.bind( createEndpoint() ) );
	}


	@Test
	public void fileDescriptorsReleased() throws Exception {
		Path fd_dir = Paths.get( "/proc/self/fd" );
		assumeTrue( Files.isDirectory( fd_dir ), "Open files cannot be counted here" );

		// The first cycle loads classes and opens any files the JVM keeps
		runServerCycle();
		long before = countEntries( fd_dir );

		runServerCycle();
		long after = countEntries( fd_dir );

		assertTrue( after <= before,
			"File descriptors leaked: " + before + " before, " + after + " after" );
	}


	@Test
	public void abortedClient() throws Exception {
		ConduitSession client = connect( 0 );
		RemoteObject root = root( client );

		TestService.TestCallback callback = new TestService.TestCallback( registry );
		try( Parcel data = new Parcel() ) {
			data.writeStrongBinder( callback );
			assertEquals( Status.OK,
				root.transact( TestService.STORE_CALLBACK, data, null, 0 ) );
		}

		ConduitExperimental.acknowledge();
		client.abort();
		assertFalse( client.isAlive() );

		assertEventually( () -> server.listSessions().isEmpty(),
			"Server did not notice the lost client" );
		assertEquals( Status.DEAD_OBJECT, Conduit.ping( service.stored_callback.get() ) );

		// The callback was released by the session when it closed
		assertEquals( 1, callback.refCnt() );
		callback.release();
	}


	@Test
	public void serverNotStarted() throws Exception {
		NettyConduitDriver idle_driver = new NettyConduitDriver();
		ConduitServer idle = ConduitServer.newBuilder()
			.driver( idle_driver )
			.build();
		try {
			Endpoint idle_endpoint = idle.bind( createEndpoint() );

			NettyConduitDriver client_driver = new NettyConduitDriver();
			assertThrows( ConnectionFailureException.class, () ->
				ConduitSession.newBuilder()
					.driver( client_driver )
					.connectTimeout( 5, TimeUnit.SECONDS )
					.connect( idle_endpoint ) );
			assertEquals( 0, client_driver.getOpenChannelCount() );
			assertTrue( idle.listSessions().isEmpty() );
		}
		finally {
			idle.shutdown();
			idle.join();
		}
		assertEquals( 0, idle_driver.getOpenChannelCount() );
	}


	@Test
	public void vsockNotSupported() {
		assertThrows( UnsupportedOperationException.class,
			() -> server.bind( Endpoint.vsock( 3, 5000 ) ) );
	}


	private ConduitSession connect( int reverse_threads ) throws IOException {
		return connect( endpoint, reverse_threads );
	}

	private ConduitSession connect( Endpoint target, int reverse_threads )
		throws IOException {

		NettyConduitDriver driver = new NettyConduitDriver();
		client_drivers.add( driver );

		ConduitSession session = ConduitSession.newBuilder()
			.driver( driver )
			.maxReverseThreads( reverse_threads )
			.connectTimeout( 10, TimeUnit.SECONDS )
			.connect( target );
		clients.add( session );
		return session;
	}


	private RemoteObject root( ConduitSession client ) {
		RemoteObject root = client.getRootObject();
		assertNotNull( root );
		to_release.add( root );
		return root;
	}


	private void runServerCycle() throws Exception {
		TestService cycle_service = new TestService( registry );
		ConduitServer cycle_server = ConduitServer.newBuilder()
			.driver( new NettyConduitDriver() )
			.build();
		try {
			cycle_server.setRootObject( cycle_service, true );
			Endpoint cycle_endpoint = cycle_server.bind( createEndpoint() );
			cycle_server.start();

			ConduitSession client = ConduitSession.newBuilder()
				.driver( new NettyConduitDriver() )
				.connect( cycle_endpoint );
			RemoteObject root = client.getRootObject();
			assertNotNull( root );
			assertEquals( Status.OK, root.ping() );
			root.release();
			assertTrue( client.shutdown( true ) );
		}
		finally {
			cycle_server.shutdown();
			cycle_server.join();
			cycle_service.release();
		}
	}


	private static long countEntries( Path directory ) throws IOException {
		try( Stream<Path> entries = Files.list( directory ) ) {
			return entries.count();
		}
	}


	private static List<Integer> readAppended( Parcel reply ) {
		int count = reply.readInt();
		List<Integer> values = new ArrayList<>( count );
		for( int i = 0; i < count; i++ ) {
			values.add( reply.readInt() );
		}
		return values;
	}

	private static int callFail( RemoteObject root, int status ) {
		try( Parcel data = new Parcel(); Parcel reply = new Parcel() ) {
			data.writeInt( status );
			return root.transact( TestService.FAIL, data, reply, 0 );
		}
	}


	private static void writeCallBack( Parcel data, RemoteObject callback, boolean oneway,
		boolean delayed ) {

		data.writeStrongBinder( callback );
		data.writeInt( 5 );
		data.writeBoolean( oneway );
		data.writeBoolean( delayed );
	}


	static void assertEventually( BooleanSupplier condition, String message )
		throws InterruptedException {

		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos( 10 );
		while( !condition.getAsBoolean() ) {
			if ( System.nanoTime() > deadline ) fail( message );
			Thread.sleep( 20 );
		}
	}
}
