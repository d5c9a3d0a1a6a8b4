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

package com.starlight.conduit.driver.netty;

import com.starlight.conduit.Endpoint;
import com.starlight.conduit.driver.ConduitDriver;
import com.starlight.conduit.driver.DriverConnection;
import com.starlight.conduit.driver.InboundMessageHandler;
import com.starlight.conduit.exception.ConnectionFailureException;
import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollDomainSocketChannel;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerDomainSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueDomainSocketChannel;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerDomainSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.channel.unix.DomainSocketAddress;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.util.AttributeKey;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;


/**
 * {@link ConduitDriver} built on Netty. INET endpoints use the NIO transport; UNIX
 * endpoints use the native epoll (Linux) or kqueue (macOS) transport when it is
 * available. VSOCK endpoints are not supported.
 * <p>
 * Event loop groups are created on first use and shut down, along with every channel,
 * by {@link #shutdown()}.
 */
public class NettyConduitDriver implements ConduitDriver {
	private static final Logger LOG = LoggerFactory.getLogger( NettyConduitDriver.class );

	private static final int DEFAULT_MAX_FRAME_LENGTH =
		Integer.getInteger( "conduit.driver.netty.max_frame_length", 64 * 1024 * 1024 );


	////////////////////////////////
	// Attributes

	// DriverConnection wrapper for the channel
	static final AttributeKey<ChannelConnection> CONNECTION_KEY =
		AttributeKey.newInstance( ".conduit_connection" );
	// Boolean indicating whether or not we initiated the connection. Null indicates false.
	static final AttributeKey<Boolean> LOCAL_INITIATE_KEY =
		AttributeKey.newInstance( ".conduit_local_initiate" );
	// Boolean indicating that the channel has been closed locally. Null indicates false.
	static final AttributeKey<Boolean> LOCAL_TERMINATE_KEY =
		AttributeKey.newInstance( ".conduit_local_terminate" );


	private final int max_frame_length;
	private final int event_loop_threads;

	private volatile InboundMessageHandler message_handler;

	// Lock for the event loop groups and socket files
	private final Lock lock = new ReentrantLock();
	private EventLoopGroup inet_group;
	private EventLoopGroup unix_group;
	private final List<Path> socket_files = new ArrayList<>();
	private boolean shut_down = false;

	private final Set<Channel> channels = ConcurrentHashMap.newKeySet();


	public static Builder newBuilder() {
		return new Builder();
	}


	public NettyConduitDriver() {
		this( DEFAULT_MAX_FRAME_LENGTH, 0 );
	}

	private NettyConduitDriver( int max_frame_length, int event_loop_threads ) {
		this.max_frame_length = max_frame_length;
		this.event_loop_threads = event_loop_threads;
	}


	/**
	 * Whether UNIX domain sockets can be used on this platform.
	 */
	public static boolean isUnixTransportAvailable() {
		return Epoll.isAvailable() || KQueue.isAvailable();
	}


	@Override
	public void init( @Nonnull InboundMessageHandler message_handler ) {
		this.message_handler = requireNonNull( message_handler );
	}


	@Override
	public boolean supports( @Nonnull Endpoint.Type type ) {
		switch( type ) {
			case INET:
				return true;
			case UNIX:
				return isUnixTransportAvailable();
			default:
				return false;
		}
	}


	@Nonnull
	@Override
	public Endpoint listen( @Nonnull Endpoint endpoint ) throws IOException {
		requireNonNull( endpoint );
		checkInitialized();

		ServerBootstrap bootstrap = new ServerBootstrap()
			.childAttr( LOCAL_INITIATE_KEY, Boolean.FALSE )
			.childHandler( new ChannelHandler() );

		SocketAddress address;
		switch( endpoint.getType() ) {
			case INET:
				bootstrap = bootstrap
					.group( group( Endpoint.Type.INET ) )
					.channel( NioServerSocketChannel.class )
					.childOption( ChannelOption.TCP_NODELAY, true )
					.childOption( ChannelOption.SO_KEEPALIVE, true );
				address = new InetSocketAddress( endpoint.getHost(), endpoint.getPort() );
				break;

			case UNIX:
				bootstrap = bootstrap
					.group( group( Endpoint.Type.UNIX ) )
					.channel( unixServerChannelClass() );
				address = new DomainSocketAddress( endpoint.getPath().toFile() );
				break;

			default:
				throw new ConnectionFailureException( "Unsupported endpoint type: " +
					endpoint.getType() );
		}

		ChannelFuture future = bootstrap.bind( address );
		try {
			future.await();
		}
		catch( InterruptedException ex ) {
			future.channel().close();
			throw new InterruptedIOException();
		}
		if ( !future.isSuccess() ) {
			throw asIOException( "Unable to listen on " + endpoint, future.cause() );
		}

		Channel channel = future.channel();
		channels.add( channel );
		channel.closeFuture().addListener( f -> channels.remove( channel ) );

		if ( endpoint.getType() == Endpoint.Type.UNIX ) {
			lock.lock();
			try {
				socket_files.add( endpoint.getPath() );
			}
			finally {
				lock.unlock();
			}
			return endpoint;
		}

		InetSocketAddress bound = ( InetSocketAddress ) channel.localAddress();
		return Endpoint.inet( endpoint.getHost(), bound.getPort() );
	}


	@Nonnull
	@Override
	public DriverConnection connect( @Nonnull Endpoint endpoint, long timeout,
		@Nonnull TimeUnit unit ) throws IOException {

		requireNonNull( endpoint );
		checkInitialized();

		long timeout_ms = Math.max( 1, unit.toMillis( timeout ) );

		Bootstrap bootstrap = new Bootstrap()
			.attr( LOCAL_INITIATE_KEY, Boolean.TRUE )
			.option( ChannelOption.CONNECT_TIMEOUT_MILLIS,
				( int ) Math.min( Integer.MAX_VALUE, timeout_ms ) )
			.handler( new ChannelHandler() );

		SocketAddress address;
		switch( endpoint.getType() ) {
			case INET:
				bootstrap = bootstrap
					.group( group( Endpoint.Type.INET ) )
					.channel( NioSocketChannel.class )
					.option( ChannelOption.TCP_NODELAY, true )
					.option( ChannelOption.SO_KEEPALIVE, true );
				address = new InetSocketAddress( endpoint.getHost(), endpoint.getPort() );
				break;

			case UNIX:
				bootstrap = bootstrap
					.group( group( Endpoint.Type.UNIX ) )
					.channel( unixChannelClass() );
				address = new DomainSocketAddress( endpoint.getPath().toFile() );
				break;

			default:
				throw new ConnectionFailureException( "Unsupported endpoint type: " +
					endpoint.getType() );
		}

		LOG.trace( "connect: {}", endpoint );
		ChannelFuture future = bootstrap.connect( address );
		try {
			if ( !future.await( timeout_ms, TimeUnit.MILLISECONDS ) ) {
				future.cancel( true );
				future.channel().close();
				throw new ConnectException( "Timed out connecting to " + endpoint );
			}
		}
		catch( InterruptedException ex ) {
			future.channel().close();
			throw new InterruptedIOException();
		}

		if ( !future.isSuccess() ) {
			throw asIOException( "Unable to connect to " + endpoint, future.cause() );
		}

		return ChannelConnection.of( future.channel(), this );
	}


	/**
	 * Close every channel and release the event loops. Waits for the event loops to
	 * terminate unless called from one of them. Calling again waits for termination
	 * that an earlier call could not wait for.
	 */
	@Override
	public void shutdown() {
		List<EventLoopGroup> groups = new ArrayList<>( 2 );
		List<Path> files;
		lock.lock();
		try {
			shut_down = true;
			if ( inet_group != null ) groups.add( inet_group );
			if ( unix_group != null ) groups.add( unix_group );
			files = new ArrayList<>( socket_files );
			socket_files.clear();
		}
		finally {
			lock.unlock();
		}

		for( Channel channel : new ArrayList<>( channels ) ) {
			channel.attr( LOCAL_TERMINATE_KEY ).set( Boolean.TRUE );
			channel.close();
		}

		groups.forEach( group -> group.shutdownGracefully( 0, 1, TimeUnit.SECONDS ) );

		if ( !isIoThread() ) {
			groups.forEach( group -> group.terminationFuture().syncUninterruptibly() );
		}

		for( Path file : files ) {
			try {
				Files.deleteIfExists( file );
			}
			catch( IOException ex ) {
				LOG.warn( "Unable to delete socket file {}", file, ex );
			}
		}
	}


	/**
	 * Number of channels (listening and connected) currently open.
	 */
	public int getOpenChannelCount() {
		return channels.size();
	}


	/**
	 * True if the current thread belongs to one of the driver's event loops.
	 */
	boolean isIoThread() {
		List<EventLoopGroup> groups = new ArrayList<>( 2 );
		lock.lock();
		try {
			if ( inet_group != null ) groups.add( inet_group );
			if ( unix_group != null ) groups.add( unix_group );
		}
		finally {
			lock.unlock();
		}

		for( EventLoopGroup group : groups ) {
			for( EventExecutor executor : group ) {
				if ( executor.inEventLoop() ) return true;
			}
		}
		return false;
	}


	void channelOpened( @Nonnull Channel channel ) {
		channels.add( channel );
	}

	void channelClosed( @Nonnull Channel channel ) {
		channels.remove( channel );
	}


	private EventLoopGroup group( Endpoint.Type type ) throws IOException {
		lock.lock();
		try {
			if ( shut_down ) throw new ClosedChannelException();

			if ( type == Endpoint.Type.INET ) {
				if ( inet_group == null ) {
					inet_group = new NioEventLoopGroup( event_loop_threads,
						new DefaultThreadFactory( "conduit-nio", true ) );
				}
				return inet_group;
			}

			if ( unix_group == null ) {
				if ( Epoll.isAvailable() ) {
					unix_group = new EpollEventLoopGroup( event_loop_threads,
						new DefaultThreadFactory( "conduit-epoll", true ) );
				}
				else if ( KQueue.isAvailable() ) {
					unix_group = new KQueueEventLoopGroup( event_loop_threads,
						new DefaultThreadFactory( "conduit-kqueue", true ) );
				}
				else {
					throw new ConnectionFailureException( "UNIX domain sockets are not " +
						"available on this platform" );
				}
			}
			return unix_group;
		}
		finally {
			lock.unlock();
		}
	}


	private static Class<? extends ServerChannel> unixServerChannelClass() {
		return Epoll.isAvailable() ?
			EpollServerDomainSocketChannel.class : KQueueServerDomainSocketChannel.class;
	}

	private static Class<? extends Channel> unixChannelClass() {
		return Epoll.isAvailable() ?
			EpollDomainSocketChannel.class : KQueueDomainSocketChannel.class;
	}


	private void checkInitialized() {
		if ( message_handler == null ) {
			throw new IllegalStateException( "Driver has not been initialized" );
		}
	}


	private static IOException asIOException( String message, Throwable cause ) {
		if ( cause instanceof IOException ) return ( IOException ) cause;
		return new IOException( message, cause );
	}


	class ChannelHandler extends ChannelInitializer<Channel> {
		@Override
		protected void initChannel( Channel channel ) {
			ChannelPipeline pipe = channel.pipeline();
			pipe.addLast( new LengthFieldBasedFrameDecoder( max_frame_length, 0, 4, 0, 4 ) );
			pipe.addLast( new NettyIMessageDecoder() );
			pipe.addLast( new NettyIMessageEncoder() );
			pipe.addLast( new ConnectionHandler( NettyConduitDriver.this, message_handler ) );
		}
	}


	public static class Builder {
		private int max_frame_length = DEFAULT_MAX_FRAME_LENGTH;
		private int event_loop_threads = 0;


		/**
		 * Largest frame accepted from a peer. Larger frames close the connection.
		 */
		public Builder maxFrameLength( int length ) {
			if ( length < 16 ) {
				throw new IllegalArgumentException( "Invalid frame length: " + length );
			}
			this.max_frame_length = length;
			return this;
		}

		/**
		 * Number of threads per event loop group. Zero (the default) lets Netty
		 * decide.
		 */
		public Builder eventLoopThreads( int threads ) {
			if ( threads < 0 ) {
				throw new IllegalArgumentException( "Invalid thread count: " + threads );
			}
			this.event_loop_threads = threads;
			return this;
		}

		public NettyConduitDriver build() {
			return new NettyConduitDriver( max_frame_length, event_loop_threads );
		}
	}
}
